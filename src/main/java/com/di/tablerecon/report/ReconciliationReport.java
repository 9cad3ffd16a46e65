package com.di.tablerecon.report;

import com.di.tablerecon.drift.ColumnConflict;
import com.di.tablerecon.drift.SchemaDiff;
import com.di.tablerecon.key.KeySet;
import com.di.tablerecon.profile.ProfileResult;
import com.di.tablerecon.rows.DuplicateKeyResult;
import com.di.tablerecon.rows.RowDiffResult;
import com.di.tablerecon.rows.UnionCoverageResult;
import com.di.tablerecon.schema.SchemaSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Terminal value of one reconciliation run. Built once by {@link ReportBuilder}; never mutated.
 * Optional parts are null when the scope did not include them or their step failed.
 */
@Value
@Builder
public class ReconciliationReport {

    String reconciliationId;
    ComparisonScope scope;
    List<String> sourceNames;
    String targetName;
    Instant startedAt;
    Instant finishedAt;

    List<SchemaSnapshot> schemas;
    KeySet keySet;
    List<RowDiffResult> rowDiffs;
    UnionCoverageResult unionCoverage;
    SchemaDiff schemaDiff;
    List<ColumnConflict> columnConflicts;
    List<DuplicateKeyResult> duplicateKeys;
    List<DatasetSummary> summaries;
    List<ProfileResult> profiles;
    List<ComparisonFailure> failures;

    ReportStatus status;
    List<String> reasons;

    public long getDurationMs() {
        return startedAt == null || finishedAt == null ? 0L : finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
