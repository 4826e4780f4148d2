package com.acme.compute.eventlog.util;

/**
 * Default capacity and tuning constants for event logs.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class EventLogDefaults {

    // ---- Queue ----
    public static final int DEFAULT_QUEUE_CAPACITY = 64;
    public static final int DEFAULT_QUEUE_MIN_SIZE = 16;
    public static final double DEFAULT_GROWTH_FACTOR = 2.0d;
    public static final double DEFAULT_SHRINK_FACTOR = 0.0d;
    public static final int MAX_QUEUE_CAPACITY = 1 << 30;
    public static final double MAX_GROWTH_FACTOR = 16.0d;
    public static final double MAX_SHRINK_FACTOR = 0.99d;

    // ---- Capture ----
    public static final int DEFAULT_VERBOSITY = 3;
    public static final int MAX_VERBOSITY = 4;

    // ---- Metrics ----
    public static final long DEFAULT_METRICS_LOG_INTERVAL_SEC = 60L;
    public static final long MAX_METRICS_LOG_INTERVAL_SEC = 3_600L;

    private EventLogDefaults() {
    }
}
