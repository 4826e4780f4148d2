package com.acme.compute.eventlog.backpressure;

import com.acme.compute.eventlog.queue.OfferResult;
import com.acme.compute.eventlog.queue.QueueSnapshot;

import java.util.Objects;

/**
 * Backpressure: a full ring keeps its oldest records and refuses new ones.
 */
public final class RejectNewestDropPolicy implements DropPolicy {
    public static final RejectNewestDropPolicy INSTANCE = new RejectNewestDropPolicy();

    private RejectNewestDropPolicy() {
    }

    @Override
    public DropDecision decide(OfferResult.Full full, QueueSnapshot snapshot) {
        Objects.requireNonNull(full, "full");
        return new DropDecision.RejectNewest(DropReasonCode.forFullReason(full.reason()));
    }
}
