package com.di.tablerecon.report;

/**
 * Unit of work inside a run. {@link #tag()} prefixes the step's log lines.
 */
public enum ReconciliationStep {
    INTROSPECT,
    KEYS,
    ROWS,
    UNION,
    SCHEMA,
    PROFILE,
    REPORT;

    public String tag() {
        return "[" + name() + "]";
    }
}
