package com.acme.compute.eventlog.memory;

/**
 * Thrown when backing storage for a ring cannot be obtained.
 * Carries the requested slot count so callers can report what was asked for.
 */
public final class AllocationDeniedException extends RuntimeException {
    private final int requestedSlots;

    public AllocationDeniedException(int requestedSlots) {
        super("Slot allocation denied, requestedSlots=" + requestedSlots);
        this.requestedSlots = requestedSlots;
    }

    public AllocationDeniedException(int requestedSlots, Throwable cause) {
        super("Slot allocation denied, requestedSlots=" + requestedSlots, cause);
        this.requestedSlots = requestedSlots;
    }

    public int requestedSlots() {
        return requestedSlots;
    }
}
