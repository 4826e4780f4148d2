package com.acme.compute.eventlog.telemetry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters written by the owning thread of an event log and read by a reporter thread.
 */
public final class AtomicQueueMetrics implements QueueMetrics {
    private final LongAdder recorded = new LongAdder();
    private final LongAdder drained = new LongAdder();
    private final LongAdder evicted = new LongAdder();
    private final AtomicLong growCount = new AtomicLong();
    private final AtomicLong shrinkCount = new AtomicLong();
    private final AtomicInteger queueDepth = new AtomicInteger();
    private final AtomicInteger queueCapacity = new AtomicInteger();
    private final AtomicInteger peakDepth = new AtomicInteger();
    private final ConcurrentHashMap<Integer, LongAdder> droppedByReason = new ConcurrentHashMap<>();

    @Override
    public void incRecorded(long n) {
        recorded.add(Math.max(0L, n));
    }

    @Override
    public void incDrained(long n) {
        drained.add(Math.max(0L, n));
    }

    @Override
    public void incDropped(long n, int reasonCode) {
        if (n <= 0) return;
        droppedByReason.computeIfAbsent(reasonCode, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incEvicted(long n) {
        evicted.add(Math.max(0L, n));
    }

    @Override
    public void observeResizes(long grows, long shrinks) {
        growCount.set(Math.max(0L, grows));
        shrinkCount.set(Math.max(0L, shrinks));
    }

    @Override
    public void setQueueDepth(int depth, int capacity) {
        int d = Math.max(0, depth);
        queueDepth.set(d);
        queueCapacity.set(Math.max(0, capacity));
        peakDepth.accumulateAndGet(d, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(
            recorded.sum(),
            drained.sum(),
            evicted.sum(),
            queueDepth.get(),
            queueCapacity.get(),
            peakDepth.get(),
            growCount.get(),
            shrinkCount.get(),
            mapToLongs(droppedByReason)
        );
    }

    private static Map<Integer, Long> mapToLongs(ConcurrentHashMap<Integer, LongAdder> src) {
        Map<Integer, Long> out = new HashMap<>();
        src.forEach((k, v) -> out.put(k, v.sum()));
        return Collections.unmodifiableMap(out);
    }

    public record Snapshot(long recorded,
                           long drained,
                           long evicted,
                           int queueDepth,
                           int queueCapacity,
                           int peakDepth,
                           long growCount,
                           long shrinkCount,
                           Map<Integer, Long> droppedByReason) {

        public long droppedTotal() {
            long total = 0;
            for (long v : droppedByReason.values()) {
                total += v;
            }
            return total;
        }
    }
}
