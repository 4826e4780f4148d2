package com.acme.compute.eventlog.backpressure;

import com.acme.compute.eventlog.queue.OfferResult;
import com.acme.compute.eventlog.queue.QueueSnapshot;

import java.util.Objects;

/**
 * Flight-recorder behaviour: a full ring sheds its oldest record so the newest
 * one always fits. An empty ring that still refuses has nothing to evict, so the
 * new element is rejected instead.
 */
public final class EvictOldestDropPolicy implements DropPolicy {
    public static final EvictOldestDropPolicy INSTANCE = new EvictOldestDropPolicy();

    private EvictOldestDropPolicy() {
    }

    @Override
    public DropDecision decide(OfferResult.Full full, QueueSnapshot snapshot) {
        Objects.requireNonNull(full, "full");
        DropReasonCode reason = DropReasonCode.forFullReason(full.reason());
        if (full.depth() <= 0) {
            return new DropDecision.RejectNewest(reason);
        }
        return new DropDecision.EvictOldest(reason);
    }
}
