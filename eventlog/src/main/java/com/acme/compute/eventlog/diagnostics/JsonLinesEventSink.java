package com.acme.compute.eventlog.diagnostics;

import com.acme.compute.eventlog.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Flushable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes events as JSON lines, one object per event.
 */
public final class JsonLinesEventSink implements EventSink {
    static final String SCHEMA = "eventlog.event.v1";

    private final Appendable out;

    public JsonLinesEventSink(Appendable out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void accept(DiagnosticEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("schema", SCHEMA);
        row.put("eventId", event.eventId());
        row.put("tsEpochMs", event.tsEpochMs());
        row.put("source", event.source().name());
        row.put("type", event.type().name());
        row.put("severity", event.severity().name());
        row.put("nativeId", event.nativeId());
        row.put("message", event.message());
        try {
            out.append(JsonCodec.writeString(row)).append('\n');
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event #" + event.eventId(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write event #" + event.eventId(), e);
        }
    }

    @Override
    public void flush() {
        if (out instanceof Flushable flushable) {
            try {
                flushable.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to flush event output", e);
            }
        }
    }
}
