package com.acme.compute.eventlog.diagnostics;

import com.acme.compute.eventlog.backpressure.OverflowMode;
import com.acme.compute.eventlog.queue.RingQueuePolicy;
import com.acme.compute.eventlog.util.EnvVars;
import com.acme.compute.eventlog.util.EventLogDefaults;
import com.acme.compute.eventlog.util.EventLogEnvKeys;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Construction parameters of an {@link EventLog}.
 *
 * @param initialCapacity        slots allocated up front
 * @param policy                 growth and shrink policy of the backing queue
 * @param verbosity              0 captures nothing, 1..4 capture severities up to that rank
 * @param overflowMode           what to do with a record the queue refuses
 * @param metricsLogIntervalSec  interval of the periodic metrics line
 */
public record EventLogConfig(
    int initialCapacity,
    RingQueuePolicy policy,
    int verbosity,
    OverflowMode overflowMode,
    long metricsLogIntervalSec
) {
    private static final Logger LOG = Logger.getLogger(EventLogConfig.class.getName());

    public EventLogConfig {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("initialCapacity must be >= 1, got " + initialCapacity);
        }
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(overflowMode, "overflowMode");
        if (verbosity < 0 || verbosity > EventLogDefaults.MAX_VERBOSITY) {
            throw new IllegalArgumentException("verbosity must be in [0, "
                + EventLogDefaults.MAX_VERBOSITY + "], got " + verbosity);
        }
        metricsLogIntervalSec = Math.max(1L, metricsLogIntervalSec);
    }

    public static EventLogConfig defaults() {
        return new EventLogConfig(
            EventLogDefaults.DEFAULT_QUEUE_CAPACITY,
            RingQueuePolicy.DEFAULT,
            EventLogDefaults.DEFAULT_VERBOSITY,
            OverflowMode.REJECT_NEWEST,
            EventLogDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC
        );
    }

    public static EventLogConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Reads the {@code EVENTLOG_*} keys. Out-of-range numbers are clamped, malformed
     * values fall back to defaults, and a growth/shrink pair that would oscillate
     * keeps growth and disables shrinking.
     */
    public static EventLogConfig fromEnv(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        int capacity = EnvVars.getIntClamped(env, EventLogEnvKeys.EVENTLOG_QUEUE_CAPACITY,
            EventLogDefaults.DEFAULT_QUEUE_CAPACITY, 1, EventLogDefaults.MAX_QUEUE_CAPACITY);
        int minSize = EnvVars.getIntClamped(env, EventLogEnvKeys.EVENTLOG_QUEUE_MIN_SIZE,
            EventLogDefaults.DEFAULT_QUEUE_MIN_SIZE, 1, EventLogDefaults.MAX_QUEUE_CAPACITY);
        double growth = EnvVars.getDoubleClamped(env, EventLogEnvKeys.EVENTLOG_QUEUE_GROWTH_FACTOR,
            EventLogDefaults.DEFAULT_GROWTH_FACTOR, 0.0d, EventLogDefaults.MAX_GROWTH_FACTOR);
        double shrink = EnvVars.getDoubleClamped(env, EventLogEnvKeys.EVENTLOG_QUEUE_SHRINK_FACTOR,
            EventLogDefaults.DEFAULT_SHRINK_FACTOR, 0.0d, EventLogDefaults.MAX_SHRINK_FACTOR);
        int verbosity = EnvVars.getIntClamped(env, EventLogEnvKeys.EVENTLOG_VERBOSITY,
            EventLogDefaults.DEFAULT_VERBOSITY, 0, EventLogDefaults.MAX_VERBOSITY);
        OverflowMode overflow = EnvVars.getEnum(env, EventLogEnvKeys.EVENTLOG_OVERFLOW_MODE,
            OverflowMode.class, OverflowMode.REJECT_NEWEST);
        long interval = EnvVars.getLongClamped(env, EventLogEnvKeys.EVENTLOG_METRICS_LOG_INTERVAL_SEC,
            EventLogDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1L, EventLogDefaults.MAX_METRICS_LOG_INTERVAL_SEC);

        if (shrink > 0.0d && (growth <= 1.0d || shrink * growth >= 1.0d)) {
            LOG.warning("Queue shrinking disabled: shrinkFactor=" + shrink
                + " is incompatible with growthFactor=" + growth);
            shrink = 0.0d;
        }
        return new EventLogConfig(
            capacity,
            new RingQueuePolicy(minSize, growth, shrink),
            verbosity,
            overflow,
            interval
        );
    }
}
