package com.acme.compute.eventlog.memory;

/**
 * Allocates slot arrays on the Java heap.
 */
public final class HeapSlotAllocator implements SlotAllocator {
    public static final HeapSlotAllocator INSTANCE = new HeapSlotAllocator();

    private HeapSlotAllocator() {
    }

    @Override
    public Object[] allocate(int slots) {
        if (slots < 1) {
            throw new IllegalArgumentException("slots must be >= 1, got " + slots);
        }
        try {
            return new Object[slots];
        } catch (OutOfMemoryError e) {
            throw new AllocationDeniedException(slots, e);
        }
    }
}
