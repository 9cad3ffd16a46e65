package com.di.tablerecon.exception;

import java.util.List;

/**
 * Key inference had no shared column to work with; an explicit key set is required.
 */
public class NoCommonKeyException extends ReconciliationException {

    public NoCommonKeyException(List<String> datasets) {
        super(String.format("No column is common to all of %s; supply explicit key columns", datasets),
                String.join(", ", datasets), null, null, null);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.NO_COMMON_KEY;
    }
}
