package com.acme.compute.eventlog.telemetry;

import com.acme.compute.eventlog.diagnostics.EventLogConfig;
import com.acme.compute.eventlog.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Logs a JSON line with the event log counters at a fixed interval.
 */
public final class PeriodicQueueMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicQueueMetricsReporter.class.getName());

    private final AtomicQueueMetrics metrics;
    private final String component;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    /** Reports every {@link EventLogConfig#metricsLogIntervalSec()} seconds. */
    public PeriodicQueueMetricsReporter(AtomicQueueMetrics metrics, EventLogConfig config) {
        this(metrics, "eventlog", Objects.requireNonNull(config, "config").metricsLogIntervalSec());
    }

    public PeriodicQueueMetricsReporter(AtomicQueueMetrics metrics, long intervalSeconds) {
        this(metrics, "eventlog", intervalSeconds);
    }

    public PeriodicQueueMetricsReporter(AtomicQueueMetrics metrics, String component, long intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.component = component == null || component.isBlank() ? "eventlog" : component;
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "eventlog-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public long intervalSeconds() {
        return intervalSeconds;
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicQueueMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", component);
        payload.put("type", "queue_metrics");
        payload.put("recorded", s.recorded());
        payload.put("drained", s.drained());
        payload.put("evicted", s.evicted());
        payload.put("queueDepth", s.queueDepth());
        payload.put("queueCapacity", s.queueCapacity());
        payload.put("peakDepth", s.peakDepth());
        payload.put("growCount", s.growCount());
        payload.put("shrinkCount", s.shrinkCount());
        payload.put("droppedByReason", s.droppedByReason());
        try {
            return JsonCodec.writeString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }

    void emit() {
        try {
            LOG.info(render());
        } catch (RuntimeException e) {
            LOG.warning("Metrics reporter failure: " + e.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
