package com.di.tablerecon.exception;

/**
 * Failure taxonomy of a reconciliation run.
 * <p>{@link #isFatalForRequest()} is true only for the target itself being unreachable;
 * every other kind is scoped to one comparison, column or statistic.
 */
public enum FailureKind {

    METADATA_UNAVAILABLE("Metadata unavailable", "Schema/catalog query failed; fallback column list used where possible"),
    NO_COMMON_KEY("No common key", "Key inference found no column shared by all datasets"),
    KEY_COLUMN_NOT_FOUND("Key column not found", "A declared or inferred key column is absent from a dataset"),
    EMPTY_KEY_SET("Empty key set", "An explicit, empty key column list was supplied"),
    QUERY_EXECUTION_FAILURE("Query execution failure", "Underlying scan or aggregate query failed or timed out"),
    COLUMN_NOT_FOUND("Column not found", "A requested column is absent from the dataset"),
    TARGET_UNAVAILABLE("Target unavailable", "The target dataset cannot be resolved at all");

    private final String title;
    private final String description;

    FailureKind(String title, String description) {
        this.title = title;
        this.description = description;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFatalForRequest() {
        return this == TARGET_UNAVAILABLE;
    }
}
