package com.acme.compute.eventlog.memory;

/**
 * Source of backing arrays for ring storage.
 */
@FunctionalInterface
public interface SlotAllocator {
    /**
     * Allocates an array of {@code slots} empty references.
     *
     * @param slots number of slots, at least 1
     * @return a fresh array, never shared with another caller
     * @throws AllocationDeniedException if the storage cannot be obtained
     */
    Object[] allocate(int slots);
}
