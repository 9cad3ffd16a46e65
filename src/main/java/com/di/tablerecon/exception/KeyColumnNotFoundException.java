package com.di.tablerecon.exception;

import java.util.List;

public class KeyColumnNotFoundException extends ReconciliationException {

    public KeyColumnNotFoundException(String dataset, String column, List<String> keyColumns) {
        super(String.format("Key column '%s' not found in '%s' (keys: %s)", column, dataset, keyColumns),
                dataset, column, keyColumns, null);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.KEY_COLUMN_NOT_FOUND;
    }
}
