package com.di.tablerecon.profile;

import com.di.tablerecon.report.ComparisonFailure;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Column profiles of one dataset plus the columns that could not be profiled.
 */
@Value
@Builder
public class ProfileResult {
    String datasetName;
    long totalRows;
    /** Null when the whole dataset was profiled. */
    ProfileWindow window;
    List<ColumnProfile> profiles;
    List<ComparisonFailure> failures;
}
