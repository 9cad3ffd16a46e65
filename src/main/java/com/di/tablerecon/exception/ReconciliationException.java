package com.di.tablerecon.exception;

import java.util.List;

/**
 * Base class of all engine failures. Carries the dataset / column / key context that
 * caused the failure so it can be reported without re-parsing the message.
 */
public abstract class ReconciliationException extends RuntimeException {

    private final String dataset;
    private final String column;
    private final List<String> keyColumns;

    protected ReconciliationException(String message, String dataset, String column,
                                      List<String> keyColumns, Throwable cause) {
        super(message, cause);
        this.dataset = dataset;
        this.column = column;
        this.keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
    }

    public abstract FailureKind kind();

    public String getDataset() {
        return dataset;
    }

    public String getColumn() {
        return column;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }
}
