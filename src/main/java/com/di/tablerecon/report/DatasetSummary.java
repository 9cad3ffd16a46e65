package com.di.tablerecon.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Row and column totals of one dataset in a consolidation run.
 */
@Value
@Builder
public class DatasetSummary {

    public enum Role { SOURCE, TARGET }

    String datasetName;
    Role role;
    /** Null when the row count could not be queried. */
    Long rowCount;
    int columnCount;

    /** Sources only: columns the target also has. */
    List<String> columnsInTarget;
    /** Sources only: columns the target lacks. */
    List<String> columnsMissingFromTarget;

    /** Target only: sum of the source row counts that could be queried. */
    Long totalSourceRows;
    /** Target only: {@code rowCount - totalSourceRows}. */
    Long rowCountDifference;
}
