package com.di.tablerecon.dataset;

/**
 * Row-count capability of the warehouse.
 */
public interface RowCountProvider {

    long countRows(DatasetHandle dataset);
}
