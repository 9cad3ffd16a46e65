package com.di.tablerecon.profile;

import lombok.Builder;
import lombok.Value;

/**
 * Distribution of one column before and after a migration or across environments.
 */
@Value
@Builder
public class ColumnShift {
    String columnName;

    long beforeNonNullCount;
    long afterNonNullCount;
    long beforeDistinctCount;
    long afterDistinctCount;
    Double beforeNullPercentage;
    Double afterNullPercentage;

    /** Failure message when either side could not be measured; counts are then zero. */
    String failure;

    public boolean failed() {
        return failure != null;
    }
}
