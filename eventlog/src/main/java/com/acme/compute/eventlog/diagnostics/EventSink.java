package com.acme.compute.eventlog.diagnostics;

/**
 * Destination for events drained from an {@link EventLog}.
 *
 * <p>Ownership of each event passes to the sink. Implementations are called
 * from the draining thread only.</p>
 */
public interface EventSink {
    void accept(DiagnosticEvent event);

    /** Called once after a drain delivered its last event. */
    default void flush() {
    }
}
