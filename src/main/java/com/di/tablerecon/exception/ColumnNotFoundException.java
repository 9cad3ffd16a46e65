package com.di.tablerecon.exception;

public class ColumnNotFoundException extends ReconciliationException {

    public ColumnNotFoundException(String dataset, String column) {
        super(String.format("Column '%s' not found in '%s'", column, dataset), dataset, column, null, null);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.COLUMN_NOT_FOUND;
    }
}
