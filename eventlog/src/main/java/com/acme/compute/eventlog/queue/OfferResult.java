package com.acme.compute.eventlog.queue;

/**
 * Outcome of {@link ElementRing#offer(Object)}. Only {@link Ok} means the ring
 * took ownership of the element.
 */
public sealed interface OfferResult permits OfferResult.Ok, OfferResult.Full, OfferResult.Closed {
    record Ok(long seq) implements OfferResult {}
    record Full(int depth, int capacity, FullReason reason) implements OfferResult {}
    record Closed() implements OfferResult {}
}
