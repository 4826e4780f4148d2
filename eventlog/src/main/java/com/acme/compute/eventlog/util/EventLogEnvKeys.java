package com.acme.compute.eventlog.util;

/**
 * Canonical environment variable names read by {@code EventLogConfig}.
 */
public final class EventLogEnvKeys {
    public static final String EVENTLOG_QUEUE_CAPACITY = "EVENTLOG_QUEUE_CAPACITY";
    public static final String EVENTLOG_QUEUE_MIN_SIZE = "EVENTLOG_QUEUE_MIN_SIZE";
    public static final String EVENTLOG_QUEUE_GROWTH_FACTOR = "EVENTLOG_QUEUE_GROWTH_FACTOR";
    public static final String EVENTLOG_QUEUE_SHRINK_FACTOR = "EVENTLOG_QUEUE_SHRINK_FACTOR";

    public static final String EVENTLOG_VERBOSITY = "EVENTLOG_VERBOSITY";
    public static final String EVENTLOG_OVERFLOW_MODE = "EVENTLOG_OVERFLOW_MODE";

    public static final String EVENTLOG_METRICS_LOG_INTERVAL_SEC = "EVENTLOG_METRICS_LOG_INTERVAL_SEC";

    private EventLogEnvKeys() {
    }
}
