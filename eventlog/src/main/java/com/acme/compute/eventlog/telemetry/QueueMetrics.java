package com.acme.compute.eventlog.telemetry;

public interface QueueMetrics {
    void incRecorded(long n);
    void incDrained(long n);
    void incDropped(long n, int reasonCode);
    void incEvicted(long n);
    void observeResizes(long growCount, long shrinkCount);
    void setQueueDepth(int depth, int capacity);
}
