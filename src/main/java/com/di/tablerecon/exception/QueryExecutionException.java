package com.di.tablerecon.exception;

import java.util.List;

/**
 * A scan or aggregate query failed or exceeded its timeout.
 */
public class QueryExecutionException extends ReconciliationException {

    private final boolean timedOut;

    public QueryExecutionException(String dataset, String column, List<String> keyColumns,
                                   String message, boolean timedOut, Throwable cause) {
        super(message, dataset, column, keyColumns, cause);
        this.timedOut = timedOut;
    }

    public QueryExecutionException(String dataset, String message, Throwable cause) {
        this(dataset, null, null, message, false, cause);
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    /** Copy with column / key context attached by a caller that knows it. */
    public QueryExecutionException withContext(String column, List<String> keyColumns) {
        QueryExecutionException copy = new QueryExecutionException(getDataset(),
                column != null ? column : getColumn(),
                keyColumns != null ? keyColumns : getKeyColumns(),
                getMessage(), timedOut, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.QUERY_EXECUTION_FAILURE;
    }
}
