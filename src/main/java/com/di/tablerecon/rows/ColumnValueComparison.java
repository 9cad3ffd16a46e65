package com.di.tablerecon.rows;

import lombok.Builder;
import lombok.Value;

/**
 * Value agreement of one column over the key-matched rows of two versions.
 */
@Value
@Builder
public class ColumnValueComparison {

    String columnName;

    /** Equal values, or NULL in both versions. */
    long sameCount;

    /** Both non-NULL and unequal. */
    long differentCount;

    long nullToValueCount;
    long valueToNullCount;

    public long comparedRows() {
        return sameCount + differentCount + nullToValueCount + valueToNullCount;
    }

    public boolean hasDifferences() {
        return differentCount + nullToValueCount + valueToNullCount > 0;
    }
}
