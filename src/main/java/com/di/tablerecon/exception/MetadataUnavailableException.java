package com.di.tablerecon.exception;

/**
 * The catalog could not describe a dataset (permissions, transient outage, or no visible columns).
 * Recoverable: callers fall back to a caller-supplied column list.
 */
public class MetadataUnavailableException extends ReconciliationException {

    public MetadataUnavailableException(String dataset, String message, Throwable cause) {
        super(String.format("Metadata unavailable for '%s': %s", dataset, message), dataset, null, null, cause);
    }

    public MetadataUnavailableException(String dataset, String message) {
        this(dataset, message, null);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.METADATA_UNAVAILABLE;
    }
}
