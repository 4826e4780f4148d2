package com.acme.compute.eventlog.diagnostics;

/**
 * Severity of a diagnostic event, ordered from most to least severe.
 *
 * <p>A log with verbosity {@code v} captures every severity whose rank is at
 * most {@code v}; verbosity 0 captures nothing.</p>
 */
public enum Severity {
    HIGH(1),
    MEDIUM(2),
    LOW(3),
    NOTIFICATION(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean capturedAt(int verbosity) {
        return rank <= verbosity;
    }
}
