package com.acme.compute.eventlog.diagnostics;

import com.acme.compute.eventlog.backpressure.DropReasonCode;
import com.acme.compute.eventlog.backpressure.OverflowMode;
import com.acme.compute.eventlog.memory.HeapSlotAllocator;
import com.acme.compute.eventlog.queue.RingQueuePolicy;
import com.acme.compute.eventlog.telemetry.AtomicQueueMetrics;
import com.acme.compute.eventlog.telemetry.NoopQueueMetrics;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventLogTest {

    @Test
    void shouldAssignIncrementingIdsAndRememberLastEvent() {
        try (EventLog log = new EventLog(EventLogConfig.defaults())) {
            assertTrue(log.record(EventSource.API, EventType.ERROR, 1280, Severity.HIGH, "invalid enum"));
            assertTrue(log.record(EventSource.API, EventType.PERFORMANCE, 7, Severity.MEDIUM, "slow path"));

            assertEquals(2, log.pendingCount());
            assertEquals(2L, log.totalCount());
            assertEquals(0L, log.peek(0).eventId());
            assertEquals(1L, log.peek(1).eventId());
            assertEquals("slow path", log.lastEvent().orElseThrow().message());
            assertEquals(1280, log.peek(0).nativeId());
        }
    }

    @Test
    void shouldFilterBySeverityAtDefaultVerbosity() {
        try (EventLog log = new EventLog(EventLogConfig.defaults())) {
            assertTrue(log.record(EventSource.API, EventType.ERROR, 0, Severity.LOW, "kept"));
            assertFalse(log.record(EventSource.API, EventType.OTHER, 0, Severity.NOTIFICATION, "noise"));

            assertEquals(1, log.pendingCount());
            assertEquals(1L, log.totalCount());
            assertEquals(1L, log.droppedCount());
            assertEquals("kept", log.lastEvent().orElseThrow().message());
        }
    }

    @Test
    void shouldStripTrailingNewlineFromMessage() {
        StringBuilder out = new StringBuilder();
        try (EventLog log = new EventLog(EventLogConfig.defaults())) {
            log.record(EventSource.API, EventType.OTHER, 0, Severity.HIGH, "driver says hi\n");
            log.record(EventSource.API, EventType.OTHER, 0, Severity.HIGH, "windows line\r\n");
            log.record(EventSource.API, EventType.OTHER, 0, Severity.HIGH, "two breaks\n\n");
            log.record(EventSource.API, EventType.OTHER, 0, Severity.HIGH, "\n");

            assertEquals("windows line", log.peek(1).message());
            assertEquals("two breaks\n", log.peek(2).message());
            assertEquals("", log.peek(3).message());

            log.drain(new TextEventSink(out));
        }
        String firstLine = out.toString().split("\n", -1)[0];
        assertTrue(firstLine.endsWith("message = driver says hi"));
        assertTrue(out.toString().startsWith(firstLine + "\neventlog: event #1:"));
    }

    @Test
    void shouldCaptureNothingAtVerbosityZero() {
        EventLogConfig config = new EventLogConfig(8, RingQueuePolicy.DEFAULT, 0, OverflowMode.REJECT_NEWEST, 60L);
        try (EventLog log = new EventLog(config)) {
            assertFalse(log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, "lost"));
            assertEquals(0, log.pendingCount());
            assertEquals(0L, log.totalCount());
            assertTrue(log.lastEvent().isEmpty());
        }
    }

    @Test
    void shouldSplitMultiLineLogIntoEvents() {
        try (EventLog log = new EventLog(EventLogConfig.defaults())) {
            int queued = log.recordLog(EventSource.SHADER_COMPILER, Severity.HIGH,
                "0:1: syntax error\r\n0:2: undeclared identifier\n\n0:3: missing main");

            assertEquals(3, queued);
            assertEquals("0:1: syntax error", log.peek(0).message());
            assertEquals("0:2: undeclared identifier", log.peek(1).message());
            assertEquals("0:3: missing main", log.peek(2).message());
            assertEquals(EventType.ERROR, log.peek(2).type());
            assertEquals(EventSource.SHADER_COMPILER, log.peek(2).source());
            assertEquals(0, log.peek(2).nativeId());
        }
    }

    @Test
    void shouldIgnoreEmptyLog() {
        try (EventLog log = new EventLog(EventLogConfig.defaults())) {
            assertEquals(0, log.recordLog(EventSource.APPLICATION, Severity.HIGH, ""));
            assertEquals(0, log.recordLog(EventSource.APPLICATION, Severity.HIGH, null));
            assertEquals(0, log.recordLog(EventSource.APPLICATION, Severity.HIGH, "\n\r\n"));
            assertEquals(0L, log.totalCount());
        }
    }

    @Test
    void shouldDrainInOrderIntoSink() {
        try (EventLog log = new EventLog(EventLogConfig.defaults())) {
            log.record(EventSource.API, EventType.ERROR, 1, Severity.HIGH, "first");
            log.record(EventSource.THIRD_PARTY, EventType.PORTABILITY, 2, Severity.LOW, "second");

            List<DiagnosticEvent> received = new ArrayList<>();
            assertEquals(2, log.drain(received::add));

            assertEquals(List.of("first", "second"), received.stream().map(DiagnosticEvent::message).toList());
            assertEquals(0, log.pendingCount());
            assertEquals(0, log.drain(received::add));
        }
    }

    @Test
    void shouldDiscardWhenDrainingWithoutSink() {
        try (EventLog log = new EventLog(EventLogConfig.defaults())) {
            log.record(EventSource.API, EventType.ERROR, 1, Severity.HIGH, "gone");
            assertEquals(1, log.drain(null));
            assertEquals(0, log.pendingCount());
        }
    }

    @Test
    void shouldGrowPastInitialCapacity() {
        EventLogConfig config = new EventLogConfig(4, RingQueuePolicy.DEFAULT, 3, OverflowMode.REJECT_NEWEST, 60L);
        try (EventLog log = new EventLog(config)) {
            for (int i = 0; i < 100; i++) {
                assertTrue(log.record(EventSource.API, EventType.ERROR, i, Severity.HIGH, "e" + i));
            }
            assertEquals(100, log.pendingCount());
            assertEquals(128, log.snapshot().capacity());
            assertEquals(0L, log.droppedCount());
        }
    }

    @Test
    void shouldRejectNewestWhenStaticQueueIsFull() {
        EventLogConfig config = new EventLogConfig(2, RingQueuePolicy.staticCapacity(), 3,
            OverflowMode.REJECT_NEWEST, 60L);
        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        try (EventLog log = new EventLog(config, metrics)) {
            assertTrue(log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, "a"));
            assertTrue(log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, "b"));
            assertFalse(log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, "c"));

            assertEquals(2, log.pendingCount());
            assertEquals(3L, log.totalCount());
            assertEquals(1L, log.droppedCount());
            assertEquals("a", log.peek(0).message());
            assertEquals("b", log.peek(1).message());
            assertEquals(2L, log.lastEvent().orElseThrow().eventId());

            AtomicQueueMetrics.Snapshot s = metrics.snapshot();
            assertEquals(2L, s.recorded());
            assertEquals(1L, s.droppedByReason().get(DropReasonCode.STATIC_CAPACITY.code()));
            assertEquals(2, s.queueDepth());
        }
    }

    @Test
    void shouldEvictOldestWhenConfigured() {
        EventLogConfig config = new EventLogConfig(2, RingQueuePolicy.staticCapacity(), 3,
            OverflowMode.EVICT_OLDEST, 60L);
        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        try (EventLog log = new EventLog(config, metrics)) {
            for (String message : List.of("a", "b", "c", "d")) {
                assertTrue(log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, message));
            }

            assertEquals(2, log.pendingCount());
            assertEquals(2L, log.droppedCount());
            assertEquals("c", log.peek(0).message());
            assertEquals("d", log.peek(1).message());
            assertEquals(2L, log.peek(0).eventId());
            assertEquals(2L, metrics.snapshot().evicted());
        }
    }

    @Test
    void shouldDropRecordsAfterClose() {
        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        EventLog log = new EventLog(EventLogConfig.defaults(), metrics);
        log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, "pending");
        log.close();

        assertTrue(log.isClosed());
        assertEquals(0, log.pendingCount());
        assertFalse(log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, "late"));
        assertEquals(1L, metrics.snapshot().droppedByReason().get(DropReasonCode.QUEUE_CLOSED.code()));
        assertEquals(0, log.drain(null));
    }

    @Test
    void shouldStampCaptureTimeFromClock() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        try (EventLog log = new EventLog(EventLogConfig.defaults(), NoopQueueMetrics.INSTANCE,
            HeapSlotAllocator.INSTANCE, clock)) {
            log.record(EventSource.APPLICATION, EventType.MARKER, 0, Severity.HIGH, null);
            assertEquals(1_700_000_000_000L, log.peek(0).tsEpochMs());
            assertEquals("", log.peek(0).message());
        }
    }

    @Test
    void shouldRejectOutOfRangePeek() {
        try (EventLog log = new EventLog(EventLogConfig.defaults())) {
            assertThrows(IndexOutOfBoundsException.class, () -> log.peek(0));
        }
    }

    @Test
    void shouldPublishDrainCountsToMetrics() {
        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        try (EventLog log = new EventLog(EventLogConfig.defaults(), metrics)) {
            log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, "a");
            log.record(EventSource.API, EventType.ERROR, 0, Severity.HIGH, "b");
            log.drain(null);

            AtomicQueueMetrics.Snapshot s = metrics.snapshot();
            assertEquals(2L, s.recorded());
            assertEquals(2L, s.drained());
            assertEquals(0, s.queueDepth());
            assertEquals(2, s.peakDepth());
            assertEquals(64, s.queueCapacity());
        }
    }
}
