package com.di.tablerecon.engine;

import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.key.KeyFallbackStrategy;
import com.di.tablerecon.profile.ColumnSpec;
import com.di.tablerecon.profile.ProfileWindow;
import com.di.tablerecon.report.ComparisonScope;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One reconciliation run: sources consolidated into a target.
 */
@Value
@Builder
public class ReconciliationRequest {

    @Singular(ignoreNullCollections = true)
    List<DatasetHandle> sources;

    DatasetHandle target;

    /** Explicit key; null asks for inference, an empty list is reported as an empty key set. */
    List<String> keyColumns;

    @Builder.Default
    ComparisonScope scope = ComparisonScope.FULL;

    @Singular(ignoreNullCollections = true)
    List<ColumnSpec> profileColumns;

    /** Profile every column of every dataset, categorized by declared type. */
    boolean profileAllColumns;

    /** Columns whose removal or change from the sources should warn, besides NOT NULL ones. */
    @Singular(ignoreNullCollections = true)
    List<String> requiredColumns;

    /** Columns assumed when a catalog cannot be read; defaults to the explicit key columns. */
    @Singular(ignoreNullCollections = true)
    List<String> fallbackColumns;

    boolean verifyKeyUniqueness;

    /** Overrides the configured fallback for this run; null keeps the configured one. */
    KeyFallbackStrategy keyFallback;

    /** Restricts profiling to a time window; null profiles whole datasets. */
    ProfileWindow window;

    public boolean hasExplicitKeys() {
        return keyColumns != null;
    }

    public boolean wantsProfiles() {
        return profileAllColumns || !profileColumns.isEmpty();
    }
}
