package com.acme.compute.eventlog.backpressure;

/**
 * Configurable name for the stock drop policies.
 */
public enum OverflowMode {
    REJECT_NEWEST,
    EVICT_OLDEST;

    public DropPolicy policy() {
        return switch (this) {
            case REJECT_NEWEST -> RejectNewestDropPolicy.INSTANCE;
            case EVICT_OLDEST -> EvictOldestDropPolicy.INSTANCE;
        };
    }
}
