package com.di.tablerecon.dataset;

import com.di.tablerecon.exception.QueryExecutionException;

import java.util.List;
import java.util.Map;

/**
 * Row-scan and aggregate query capability of the warehouse.
 * <p>
 * Implementations must be read-only and bound each statement by a timeout. Every failure,
 * including a timeout, surfaces as {@link QueryExecutionException} carrying {@code context}
 * (the dataset or datasets the query reads).
 */
public interface QueryExecutor {

    /** Runs a query that returns a single numeric value. NULL is returned as 0. */
    long queryForLong(String context, String sql, Object... args);

    /** Runs a query returning one row; column order is preserved. */
    Map<String, Object> queryForRow(String context, String sql, Object... args);

    /** Runs a query returning any number of rows; column order is preserved. */
    List<Map<String, Object>> queryForRows(String context, String sql, Object... args);
}
