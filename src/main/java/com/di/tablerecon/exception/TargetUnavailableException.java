package com.di.tablerecon.exception;

/**
 * The target dataset cannot be resolved at all. Fatal for the whole request.
 */
public class TargetUnavailableException extends ReconciliationException {

    public TargetUnavailableException(String dataset, Throwable cause) {
        super(String.format("Target dataset '%s' cannot be resolved: %s", dataset,
                cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown cause"),
                dataset, null, null, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TARGET_UNAVAILABLE;
    }
}
