package com.acme.compute.eventlog.diagnostics;

import java.io.Flushable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Writes one human-readable line per event.
 */
public final class TextEventSink implements EventSink {
    private final Appendable out;

    public TextEventSink(Appendable out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    static String format(DiagnosticEvent event) {
        return "eventlog: event #" + event.eventId()
            + ": " + event.type()
            + ", severity: " + event.severity()
            + ", source: " + event.source()
            + ", message = " + event.message();
    }

    @Override
    public void accept(DiagnosticEvent event) {
        try {
            out.append(format(event)).append('\n');
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
