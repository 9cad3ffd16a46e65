package com.di.tablerecon.report;

/**
 * Which checks a reconciliation run performs.
 */
public enum ComparisonScope {
    /** Each source against the target, row by row. */
    ROWS,
    /** The union of all sources against the target. */
    UNION,
    /** Schema drift of the merged sources against the target. */
    SCHEMA,
    /** All of the above. */
    FULL;

    public boolean includesRows() {
        return this == ROWS || this == FULL;
    }

    public boolean includesUnion() {
        return this == UNION || this == FULL;
    }

    public boolean includesSchema() {
        return this == SCHEMA || this == FULL;
    }

    public boolean needsKeys() {
        return this != SCHEMA;
    }
}
