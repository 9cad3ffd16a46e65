package com.di.tablerecon.report;

import com.di.tablerecon.drift.ColumnConflict;
import com.di.tablerecon.drift.SchemaDiff;
import com.di.tablerecon.key.KeySet;
import com.di.tablerecon.profile.ProfileResult;
import com.di.tablerecon.rows.DuplicateKeyResult;
import com.di.tablerecon.rows.RowDiffResult;
import com.di.tablerecon.rows.UnionCoverageResult;
import com.di.tablerecon.schema.SchemaSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges the partial results of a run into a {@link ReconciliationReport} and derives its status.
 * <p>
 * Pure assembly: findings are taken as given, never recomputed or dropped. Not thread-safe;
 * the orchestrating thread feeds it after the workers have finished.
 *
 * <p>Status rules, in order:
 * <ol>
 *   <li>{@code ERROR} when any failure was not recovered;</li>
 *   <li>{@code WARNING} when rows or key-tuples are missing, a key or required column was removed
 *       or changed, duplicate keys were found, or a column conflict was flagged;</li>
 *   <li>{@code OK} otherwise.</li>
 * </ol>
 * Required columns are the caller's required columns plus the NOT NULL columns of the before side.
 */
public class ReportBuilder {

    private final String reconciliationId;
    private final ComparisonScope scope;
    private final List<String> sourceNames;
    private final String targetName;
    private final Instant startedAt;

    private final List<SchemaSnapshot> schemas = new ArrayList<>();
    private KeySet keySet;
    private final List<RowDiffResult> rowDiffs = new ArrayList<>();
    private UnionCoverageResult unionCoverage;
    private SchemaDiff schemaDiff;
    private final List<ColumnConflict> columnConflicts = new ArrayList<>();
    private final List<DuplicateKeyResult> duplicateKeys = new ArrayList<>();
    private final List<DatasetSummary> summaries = new ArrayList<>();
    private final List<ProfileResult> profiles = new ArrayList<>();
    private final List<ComparisonFailure> failures = new ArrayList<>();
    private final Set<String> requiredColumns = new LinkedHashSet<>();

    public ReportBuilder(String reconciliationId, ComparisonScope scope, List<String> sourceNames,
                         String targetName, Instant startedAt) {
        this.reconciliationId = reconciliationId;
        this.scope = scope;
        this.sourceNames = List.copyOf(sourceNames);
        this.targetName = targetName;
        this.startedAt = startedAt;
    }

    public ReportBuilder schema(SchemaSnapshot snapshot) {
        if (snapshot != null) {
            schemas.add(snapshot);
        }
        return this;
    }

    public ReportBuilder keySet(KeySet keys) {
        this.keySet = keys;
        return this;
    }

    public ReportBuilder rowDiff(RowDiffResult result) {
        rowDiffs.add(result);
        return this;
    }

    public ReportBuilder unionCoverage(UnionCoverageResult result) {
        this.unionCoverage = result;
        return this;
    }

    public ReportBuilder schemaDiff(SchemaDiff diff) {
        this.schemaDiff = diff;
        return this;
    }

    public ReportBuilder columnConflicts(Collection<ColumnConflict> conflicts) {
        columnConflicts.addAll(conflicts);
        return this;
    }

    public ReportBuilder duplicateKeys(DuplicateKeyResult result) {
        duplicateKeys.add(result);
        return this;
    }

    public ReportBuilder summary(DatasetSummary summary) {
        summaries.add(summary);
        return this;
    }

    public ReportBuilder profile(ProfileResult result) {
        profiles.add(result);
        failures.addAll(result.getFailures());
        return this;
    }

    public ReportBuilder failure(ComparisonFailure failure) {
        failures.add(failure);
        return this;
    }

    public ReportBuilder requiredColumns(Collection<String> columns) {
        if (columns != null) {
            columns.stream().filter(c -> c != null && !c.isBlank()).map(String::trim).forEach(requiredColumns::add);
        }
        return this;
    }

    public ReconciliationReport build() {
        return build(Instant.now());
    }

    public ReconciliationReport build(Instant finishedAt) {
        List<String> reasons = new ArrayList<>();
        ReportStatus status = deriveStatus(reasons);
        return ReconciliationReport.builder()
                .reconciliationId(reconciliationId)
                .scope(scope)
                .sourceNames(sourceNames)
                .targetName(targetName)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .schemas(List.copyOf(schemas))
                .keySet(keySet)
                .rowDiffs(List.copyOf(rowDiffs))
                .unionCoverage(unionCoverage)
                .schemaDiff(schemaDiff)
                .columnConflicts(List.copyOf(columnConflicts))
                .duplicateKeys(List.copyOf(duplicateKeys))
                .summaries(List.copyOf(summaries))
                .profiles(List.copyOf(profiles))
                .failures(List.copyOf(failures))
                .status(status)
                .reasons(List.copyOf(reasons))
                .build();
    }

    private ReportStatus deriveStatus(List<String> reasons) {
        boolean error = false;
        for (ComparisonFailure failure : failures) {
            if (!failure.recovered()) {
                error = true;
                reasons.add(failure.describe());
            }
        }

        int warnings = 0;
        for (RowDiffResult diff : rowDiffs) {
            if (diff.hasMissingRows()) {
                warnings++;
                reasons.add(String.format("%,d rows of %s missing from %s (keys %s)",
                        diff.getMissingCount(), diff.getSourceName(), diff.getTargetName(), diff.getKeyColumns()));
            }
        }
        if (unionCoverage != null && unionCoverage.hasMissingKeys()) {
            warnings++;
            reasons.add(String.format("%,d key-tuples of the union of %s missing from %s (keys %s)",
                    unionCoverage.getMissingKeyCount(), unionCoverage.getSourceNames(),
                    unionCoverage.getTargetName(), unionCoverage.getKeyColumns()));
        }
        if (schemaDiff != null) {
            if (keySet != null) {
                Set<String> keyHits = schemaDiff.removedOrChangedAmong(keySet.columns());
                if (!keyHits.isEmpty()) {
                    warnings++;
                    reasons.add("Key columns removed or changed in " + schemaDiff.afterName() + ": " + keyHits);
                }
            }
            Set<String> required = new LinkedHashSet<>(requiredColumns);
            required.addAll(schemaDiff.requiredBefore());
            Set<String> requiredHits = schemaDiff.removedOrChangedAmong(required);
            if (keySet != null) {
                requiredHits.removeIf(keySet::contains);
            }
            if (!requiredHits.isEmpty()) {
                warnings++;
                reasons.add("Required columns removed or changed in " + schemaDiff.afterName() + ": " + requiredHits);
            }
        }
        for (DuplicateKeyResult duplicates : duplicateKeys) {
            if (duplicates.hasDuplicates()) {
                warnings++;
                reasons.add(String.format("%s has %,d duplicated key-tuples on %s",
                        duplicates.getDatasetName(), duplicates.getDuplicateKeyCount(), duplicates.getKeyColumns()));
            }
        }
        for (ColumnConflict conflict : columnConflicts) {
            warnings++;
            reasons.add("Column conflict " + conflict.describe());
        }

        if (error) {
            return ReportStatus.ERROR;
        }
        return warnings > 0 ? ReportStatus.WARNING : ReportStatus.OK;
    }
}
