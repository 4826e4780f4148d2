package com.acme.compute.eventlog.diagnostics;

public enum EventType {
    ERROR,
    DEPRECATED_BEHAVIOR,
    UNDEFINED_BEHAVIOR,
    PORTABILITY,
    PERFORMANCE,
    MARKER,
    PUSH_GROUP,
    POP_GROUP,
    OTHER
}
