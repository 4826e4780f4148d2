package com.acme.compute.eventlog.diagnostics;

import java.util.Objects;

/**
 * One captured diagnostic record.
 *
 * @param eventId   incrementing id assigned by the capturing {@link EventLog}
 * @param source    subsystem that produced the message
 * @param type      category of the message
 * @param nativeId  id assigned by the producer, 0 when it has none
 * @param severity  severity of the message
 * @param message   message text, never null
 * @param tsEpochMs capture time
 */
public record DiagnosticEvent(
    long eventId,
    EventSource source,
    EventType type,
    int nativeId,
    Severity severity,
    String message,
    long tsEpochMs
) {
    public DiagnosticEvent {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }
}
