package com.acme.compute.eventlog.diagnostics;

public final class NoopEventSink implements EventSink {
    public static final NoopEventSink INSTANCE = new NoopEventSink();

    private NoopEventSink() {
    }

    @Override
    public void accept(DiagnosticEvent event) {
    }
}
