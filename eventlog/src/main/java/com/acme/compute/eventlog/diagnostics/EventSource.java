package com.acme.compute.eventlog.diagnostics;

public enum EventSource {
    API, WINDOW_SYSTEM, SHADER_COMPILER, THIRD_PARTY, APPLICATION, OTHER
}
