package com.acme.compute.eventlog.util;

import java.util.Locale;
import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Every accessor has a {@code Map} overload so configuration can be built
 * from a fixed map in tests. Blank or malformed values fall back to the default.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * Parses a double and clamps it to {@code [min, max]}. {@code NaN} and infinities
     * count as malformed.
     */
    public static double getDoubleClamped(Map<String, String> env,
                                          String name,
                                          double defaultValue,
                                          double min,
                                          double max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            if (!Double.isFinite(parsed)) return defaultValue;
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * Case-insensitive enum lookup; dashes are accepted in place of underscores.
     */
    public static <T extends Enum<T>> T getEnum(Map<String, String> env, String name, Class<T> type, T defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException ignored) {
            return defaultValue;
        }
    }
}
