package com.acme.compute.eventlog.backpressure;

import com.acme.compute.eventlog.queue.OfferResult;
import com.acme.compute.eventlog.queue.QueueSnapshot;

/**
 * Decides what a producer does when a ring refuses an element.
 *
 * <p>The ring itself never drops data; this is the caller-side half of the
 * overflow contract.</p>
 */
public interface DropPolicy {
    /**
     * @param full     the refusal returned by the ring
     * @param snapshot ring state at the time of the refusal
     * @return whether to give up on the new element or make room for it
     */
    DropDecision decide(OfferResult.Full full, QueueSnapshot snapshot);
}
