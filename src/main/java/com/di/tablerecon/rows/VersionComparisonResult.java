package com.di.tablerecon.rows;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Old-versus-new comparison of one dataset (two model versions, or two environments).
 */
@Value
@Builder
public class VersionComparisonResult {

    String oldName;
    String newName;
    List<String> keyColumns;

    long oldRecordCount;
    long newRecordCount;
    long recordsInOldNotInNew;
    long recordsInNewNotInOld;

    /** {@code |new - old|}. */
    long recordCountDifference;

    /** {@code |new - old| / old * 100}, rounded to 2 decimals; null when the old version is empty. */
    Double percentageChange;

    List<ColumnValueComparison> columnValueComparisons;

    /** Column name to failure message, for columns whose comparison could not run. */
    Map<String, String> failedColumns;
}
