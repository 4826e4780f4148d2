package com.acme.compute.eventlog.queue;

public record QueueSnapshot(
    int depth,
    int capacity,
    long headSeq,
    long tailSeq,
    long growCount,
    long shrinkCount,
    long failedAllocations,
    long tsNanos
) {
    public long resizeCount() {
        return growCount + shrinkCount;
    }
}
