package com.di.tablerecon.profile;

import lombok.Builder;
import lombok.Value;

/**
 * Statistics of one column. Which fields are filled depends on {@link #category}:
 * <ul>
 *   <li>NUMERIC: min/max value, mean, median</li>
 *   <li>STRING: min/max/avg length, distinct count</li>
 *   <li>TEMPORAL: min/max value, span in days</li>
 *   <li>UNKNOWN: null counts only</li>
 * </ul>
 */
@Value
@Builder
public class ColumnProfile {

    String columnName;
    ColumnCategory category;
    String declaredType;

    long totalRows;
    long nonNullCount;
    long nullCount;
    /** {@code 100 * nullCount / totalRows}; null (undefined) when the dataset has no rows. */
    Double nullPercentage;

    /** Numeric min/max as Double; temporal min/max as LocalDate or LocalDateTime. */
    Object minValue;
    Object maxValue;
    Double mean;
    Double median;

    Integer minLength;
    Integer maxLength;
    Double avgLength;
    Long distinctCount;

    Long spanDays;

    /** {@code 100 * nullCount / totalRows}, or null when {@code totalRows} is 0. */
    public static Double nullPercentage(long nullCount, long totalRows) {
        return totalRows == 0 ? null : 100.0 * nullCount / totalRows;
    }
}
