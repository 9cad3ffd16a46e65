package com.di.tablerecon.report;

import com.di.tablerecon.exception.ErrorCategory;
import com.di.tablerecon.exception.FailureKind;
import com.di.tablerecon.exception.QueryExecutionException;
import com.di.tablerecon.exception.ReconciliationException;

import java.util.List;

/**
 * A failure scoped to one comparison, column or statistic, reported instead of aborting the run.
 *
 * @param recovered true when the run worked around the failure (e.g. fallback column list)
 */
public record ComparisonFailure(FailureKind kind, ReconciliationStep step, String dataset, String column,
                                List<String> keyColumns, String message, ErrorCategory errorCategory,
                                boolean recovered) {

    public ComparisonFailure {
        keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
    }

    public static ComparisonFailure of(ReconciliationStep step, ReconciliationException e) {
        return of(step, e, false);
    }

    public static ComparisonFailure of(ReconciliationStep step, ReconciliationException e, boolean recovered) {
        return new ComparisonFailure(e.kind(), step, e.getDataset(), e.getColumn(), e.getKeyColumns(),
                e.getMessage(), ErrorCategory.categorize(e), recovered);
    }

    /**
     * Wraps a throwable that escaped the engine's own exception types.
     */
    public static ComparisonFailure unexpected(ReconciliationStep step, String dataset, Throwable t) {
        if (t instanceof ReconciliationException re) {
            return of(step, re);
        }
        return of(step, new QueryExecutionException(dataset, String.valueOf(t.getMessage()), t));
    }

    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append(step.tag()).append(' ')
                .append(kind.getTitle());
        if (dataset != null) {
            sb.append(" | dataset=").append(dataset);
        }
        if (column != null) {
            sb.append(" | column=").append(column);
        }
        if (!keyColumns.isEmpty()) {
            sb.append(" | keys=").append(keyColumns);
        }
        sb.append(" | ").append(message);
        if (recovered) {
            sb.append(" (recovered)");
        }
        return sb.toString();
    }
}
