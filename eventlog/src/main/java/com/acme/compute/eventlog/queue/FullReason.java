package com.acme.compute.eventlog.queue;

/**
 * Why a full ring refused to grow.
 */
public enum FullReason {
    /** Growth factor is {@code <= 1.0}; the ring never reallocates upward. */
    STATIC_CAPACITY,
    /** {@code floor(size * growthFactor)} did not exceed the current capacity. */
    NO_EFFECTIVE_GROWTH,
    /** The larger backing store could not be allocated. */
    ALLOCATION_DENIED
}
