package com.acme.compute.eventlog.backpressure;

import com.acme.compute.eventlog.queue.FullReason;

public enum DropReasonCode {
    STATIC_CAPACITY, GROWTH_DENIED, QUEUE_CLOSED, BELOW_VERBOSITY;

    /** Stable numeric code for metrics keys. */
    public int code() {
        return ordinal() + 1;
    }

    public static DropReasonCode forFullReason(FullReason reason) {
        return switch (reason) {
            case STATIC_CAPACITY -> STATIC_CAPACITY;
            case NO_EFFECTIVE_GROWTH, ALLOCATION_DENIED -> GROWTH_DENIED;
        };
    }
}
