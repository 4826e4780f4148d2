package com.acme.compute.eventlog.diagnostics;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Forwards drained events to a {@link Logger}, mapping severity to level.
 */
public final class LoggingEventSink implements EventSink {
    private final Logger logger;

    public LoggingEventSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public LoggingEventSink() {
        this(Logger.getLogger(EventLog.class.getName()));
    }

    static Level levelOf(Severity severity) {
        return switch (severity) {
            case HIGH -> Level.SEVERE;
            case MEDIUM -> Level.WARNING;
            case LOW -> Level.INFO;
            case NOTIFICATION -> Level.FINE;
        };
    }

    @Override
    public void accept(DiagnosticEvent event) {
        Level level = levelOf(event.severity());
        if (logger.isLoggable(level)) {
            logger.log(level, TextEventSink.format(event));
        }
    }
}
