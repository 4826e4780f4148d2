package com.acme.compute.eventlog.telemetry;

public final class NoopQueueMetrics implements QueueMetrics {
    public static final NoopQueueMetrics INSTANCE = new NoopQueueMetrics();

    private NoopQueueMetrics() {
    }

    @Override
    public void incRecorded(long n) {
    }

    @Override
    public void incDrained(long n) {
    }

    @Override
    public void incDropped(long n, int reasonCode) {
    }

    @Override
    public void incEvicted(long n) {
    }

    @Override
    public void observeResizes(long growCount, long shrinkCount) {
    }

    @Override
    public void setQueueDepth(int depth, int capacity) {
    }
}
