package com.acme.compute.eventlog.diagnostics;

import com.acme.compute.eventlog.backpressure.DropDecision;
import com.acme.compute.eventlog.backpressure.DropPolicy;
import com.acme.compute.eventlog.backpressure.DropReasonCode;
import com.acme.compute.eventlog.memory.HeapSlotAllocator;
import com.acme.compute.eventlog.memory.SlotAllocator;
import com.acme.compute.eventlog.queue.OfferResult;
import com.acme.compute.eventlog.queue.QueueSnapshot;
import com.acme.compute.eventlog.queue.RingQueue;
import com.acme.compute.eventlog.telemetry.NoopQueueMetrics;
import com.acme.compute.eventlog.telemetry.QueueMetrics;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers diagnostic events until a consumer drains them.
 *
 * <p>Producers call {@link #record} whenever a message arrives; events below
 * the configured verbosity are counted and discarded. Every event that passes
 * the filter gets the next id, even when the queue then refuses it, so gaps in
 * drained ids show how many records were lost. Consumers call {@link #drain}
 * and take ownership of every event handed to their sink.</p>
 *
 * <p>Not thread-safe; producers and the consumer must share one thread or
 * synchronize externally.</p>
 */
public final class EventLog implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(EventLog.class.getName());

    private final RingQueue<DiagnosticEvent> queue;
    private final DropPolicy dropPolicy;
    private final QueueMetrics metrics;
    private final Clock clock;
    private final int verbosity;

    private long totalCount;
    private long droppedCount;
    private DiagnosticEvent lastEvent;

    public EventLog(EventLogConfig config) {
        this(config, NoopQueueMetrics.INSTANCE);
    }

    public EventLog(EventLogConfig config, QueueMetrics metrics) {
        this(config, metrics, HeapSlotAllocator.INSTANCE, Clock.systemUTC());
    }

    EventLog(EventLogConfig config, QueueMetrics metrics, SlotAllocator allocator, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.queue = new RingQueue<>(config.initialCapacity(), config.policy(), allocator);
        this.dropPolicy = config.overflowMode().policy();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.verbosity = config.verbosity();
        publishDepth();
    }

    /**
     * Captures one event.
     *
     * @return {@code true} if the event is now queued
     */
    public boolean record(EventSource source, EventType type, int nativeId, Severity severity, String message) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        if (!severity.capturedAt(verbosity)) {
            drop(DropReasonCode.BELOW_VERBOSITY);
            return false;
        }
        if (queue.isClosed()) {
            drop(DropReasonCode.QUEUE_CLOSED);
            return false;
        }
        DiagnosticEvent event = new DiagnosticEvent(
            totalCount,
            source,
            type,
            nativeId,
            severity,
            stripTrailingNewline(message),
            clock.millis()
        );
        totalCount++;
        lastEvent = event;
        boolean queued = enqueue(event);
        publishDepth();
        return queued;
    }

    /**
     * Captures every non-empty line of a multi-line program or compiler log as a
     * separate {@link EventType#ERROR} event.
     *
     * @return number of events queued
     */
    public int recordLog(EventSource source, Severity severity, String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int queued = 0;
        int lineStart = 0;
        int length = text.length();
        for (int i = 0; i <= length; i++) {
            if (i == length || text.charAt(i) == '\n') {
                int lineEnd = i;
                if (lineEnd > lineStart && text.charAt(lineEnd - 1) == '\r') {
                    lineEnd--;
                }
                if (lineEnd > lineStart
                    && record(source, EventType.ERROR, 0, severity, text.substring(lineStart, lineEnd))) {
                    queued++;
                }
                lineStart = i + 1;
            }
        }
        return queued;
    }

    /**
     * Pops every queued event into {@code sink}. A {@code null} sink discards them.
     *
     * @return number of events drained
     */
    public int drain(EventSink sink) {
        EventSink target = sink == null ? NoopEventSink.INSTANCE : sink;
        int drained = 0;
        try {
            DiagnosticEvent event;
            while ((event = queue.poll()) != null) {
                drained++;
                target.accept(event);
            }
            target.flush();
        } finally {
            metrics.incDrained(drained);
            publishDepth();
        }
        return drained;
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is not below {@link #pendingCount()}
     */
    public DiagnosticEvent peek(int index) {
        return queue.peek(index);
    }

    public int pendingCount() {
        return queue.size();
    }

    /** Events that passed the verbosity filter, queued or not. */
    public long totalCount() {
        return totalCount;
    }

    /** Events discarded by the filter, refused by the queue, evicted, or recorded after close. */
    public long droppedCount() {
        return droppedCount;
    }

    public Optional<DiagnosticEvent> lastEvent() {
        return Optional.ofNullable(lastEvent);
    }

    public int verbosity() {
        return verbosity;
    }

    public QueueSnapshot snapshot() {
        return queue.snapshot();
    }

    public boolean isClosed() {
        return queue.isClosed();
    }

    /**
     * Discards pending events and releases the queue. Later records are dropped.
     */
    @Override
    public void close() {
        int before = queue.size();
        queue.close();
        if (before > 0) {
            LOG.fine(() -> "Event log closed with " + before + " undrained events");
        }
        publishDepth();
    }

    private boolean enqueue(DiagnosticEvent event) {
        OfferResult result = queue.offer(event);
        if (result instanceof OfferResult.Ok) {
            metrics.incRecorded(1);
            return true;
        }
        if (result instanceof OfferResult.Closed) {
            drop(DropReasonCode.QUEUE_CLOSED);
            return false;
        }
        OfferResult.Full full = (OfferResult.Full) result;
        DropDecision decision = dropPolicy.decide(full, queue.snapshot());
        if (decision instanceof DropDecision.EvictOldest evict) {
            DiagnosticEvent evicted = queue.poll();
            if (evicted != null) {
                drop(evict.reason());
                metrics.incEvicted(1);
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Evicted event #" + evicted.eventId() + " to make room for #" + event.eventId());
                }
                if (queue.offer(event) instanceof OfferResult.Ok) {
                    metrics.incRecorded(1);
                    return true;
                }
            }
            drop(evict.reason());
            return false;
        }
        DropDecision.RejectNewest reject = (DropDecision.RejectNewest) decision;
        drop(reject.reason());
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Rejected event #" + event.eventId() + ": " + full.reason()
                + " depth=" + full.depth() + " capacity=" + full.capacity());
        }
        return false;
    }

    /** Drops one trailing line break; driver messages usually carry one. */
    static String stripTrailingNewline(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }
        int end = message.length();
        if (message.charAt(end - 1) == '\n') {
            end--;
            if (end > 0 && message.charAt(end - 1) == '\r') {
                end--;
            }
        }
        return end == message.length() ? message : message.substring(0, end);
    }

    private void drop(DropReasonCode reason) {
        droppedCount++;
        metrics.incDropped(1, reason.code());
    }

    private void publishDepth() {
        QueueSnapshot s = queue.snapshot();
        metrics.setQueueDepth(s.depth(), s.capacity());
        metrics.observeResizes(s.growCount(), s.shrinkCount());
    }
}
