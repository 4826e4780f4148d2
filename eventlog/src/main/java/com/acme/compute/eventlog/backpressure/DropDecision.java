package com.acme.compute.eventlog.backpressure;

public sealed interface DropDecision permits DropDecision.RejectNewest, DropDecision.EvictOldest {
    /** The incoming element is refused; the queue keeps what it has. */
    record RejectNewest(DropReasonCode reason) implements DropDecision {}
    /** The oldest queued element is released to make room, then the push is retried once. */
    record EvictOldest(DropReasonCode reason) implements DropDecision {}
}
