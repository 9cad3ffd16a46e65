package com.di.tablerecon.report;

import com.di.tablerecon.drift.ColumnChange;
import com.di.tablerecon.drift.ColumnConflict;
import com.di.tablerecon.drift.SchemaDiff;
import com.di.tablerecon.profile.ColumnProfile;
import com.di.tablerecon.profile.ProfileResult;
import com.di.tablerecon.rows.DuplicateKeyResult;
import com.di.tablerecon.rows.RowDiffResult;
import com.di.tablerecon.rows.UnionCoverageResult;
import com.di.tablerecon.schema.SchemaSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives the human-readable log lines of a finished report. Formatting only; reads nothing
 * but the report.
 */
public class ReportLogFormatter {

    private static final String INDENT = "    ";

    public List<String> format(ReconciliationReport report) {
        List<String> lines = new ArrayList<>();
        String reportTag = ReconciliationStep.REPORT.tag();

        lines.add(String.format("%s Reconciliation %s | scope=%s | sources=%s | target=%s",
                reportTag, report.getReconciliationId(), report.getScope(), report.getSourceNames(),
                report.getTargetName()));

        for (SchemaSnapshot snapshot : report.getSchemas()) {
            lines.add(String.format("%s %s: %d columns%s", ReconciliationStep.INTROSPECT.tag(),
                    snapshot.dataset(), snapshot.columnCount(), snapshot.authoritative() ? "" : " (fallback column list)"));
        }

        if (report.getKeySet() != null) {
            lines.add(ReconciliationStep.KEYS.tag() + " Key columns: " + report.getKeySet());
        }
        for (DuplicateKeyResult duplicates : report.getDuplicateKeys()) {
            lines.add(duplicates.hasDuplicates()
                    ? String.format("%s %s: %,d duplicated key-tuples (%,d rows, max %d occurrences)",
                            ReconciliationStep.KEYS.tag(), duplicates.getDatasetName(),
                            duplicates.getDuplicateKeyCount(), duplicates.getTotalDuplicateRows(),
                            duplicates.getMaxOccurrences())
                    : String.format("%s %s: key is unique", ReconciliationStep.KEYS.tag(), duplicates.getDatasetName()));
            duplicates.getSamples().forEach(s -> lines.add(INDENT + formatRow(s)));
        }

        for (RowDiffResult diff : report.getRowDiffs()) {
            lines.add(String.format("%s %s -> %s: %,d missing rows", ReconciliationStep.ROWS.tag(),
                    diff.getSourceName(), diff.getTargetName(), diff.getMissingCount()));
            diff.getSampleMissingRows().forEach(r -> lines.add(INDENT + formatRow(r)));
        }

        UnionCoverageResult union = report.getUnionCoverage();
        if (union != null) {
            lines.add(String.format("%s union of %s -> %s: %,d missing key-tuples", ReconciliationStep.UNION.tag(),
                    union.getSourceNames(), union.getTargetName(), union.getMissingKeyCount()));
            union.getSampleMissingKeys().forEach(k -> lines.add(INDENT + formatRow(k)));
        }

        SchemaDiff diff = report.getSchemaDiff();
        if (diff != null) {
            String schema = ReconciliationStep.SCHEMA.tag();
            if (!diff.hasDrift()) {
                lines.add(String.format("%s %s -> %s: no drift", schema, diff.beforeName(), diff.afterName()));
            } else {
                lines.add(String.format("%s %s -> %s: %d added, %d removed, %d changed", schema,
                        diff.beforeName(), diff.afterName(), diff.added().size(), diff.removed().size(),
                        diff.changed().size()));
                diff.added().forEach(c -> lines.add(INDENT + "+ " + c));
                diff.removed().forEach(c -> lines.add(INDENT + "- " + c));
                for (ColumnChange change : diff.changed()) {
                    lines.add(INDENT + "~ " + change.describe());
                }
            }
        }
        for (ColumnConflict conflict : report.getColumnConflicts()) {
            lines.add(ReconciliationStep.SCHEMA.tag() + " Conflict " + conflict.describe());
        }

        for (DatasetSummary summary : report.getSummaries()) {
            lines.add(formatSummary(summary));
        }

        for (ProfileResult result : report.getProfiles()) {
            lines.add(String.format("%s %s: %,d rows%s", ReconciliationStep.PROFILE.tag(), result.getDatasetName(),
                    result.getTotalRows(), result.getWindow() == null ? "" : " in " + result.getWindow()));
            result.getProfiles().forEach(p -> lines.add(INDENT + formatProfile(p)));
        }

        for (ComparisonFailure failure : report.getFailures()) {
            lines.add(failure.describe());
        }

        lines.add(String.format("%s Status: %s (%d ms)", reportTag, report.getStatus(), report.getDurationMs()));
        report.getReasons().forEach(r -> lines.add(INDENT + "- " + r));
        return List.copyOf(lines);
    }

    private static String formatSummary(DatasetSummary summary) {
        String rows = summary.getRowCount() == null ? "n/a" : String.format("%,d", summary.getRowCount());
        if (summary.getRole() == DatasetSummary.Role.TARGET) {
            return String.format("%s target %s: %s rows, %d columns, %s source rows, difference %s",
                    ReconciliationStep.REPORT.tag(), summary.getDatasetName(), rows, summary.getColumnCount(),
                    summary.getTotalSourceRows() == null ? "n/a" : String.format("%,d", summary.getTotalSourceRows()),
                    summary.getRowCountDifference() == null ? "n/a" : String.format("%+,d", summary.getRowCountDifference()));
        }
        return String.format("%s source %s: %s rows, %d columns, %d in target, missing from target %s",
                ReconciliationStep.REPORT.tag(), summary.getDatasetName(), rows, summary.getColumnCount(),
                summary.getColumnsInTarget() == null ? 0 : summary.getColumnsInTarget().size(),
                summary.getColumnsMissingFromTarget() == null ? List.of() : summary.getColumnsMissingFromTarget());
    }

    private static String formatProfile(ColumnProfile p) {
        StringBuilder sb = new StringBuilder()
                .append(p.getColumnName()).append(" (").append(p.getCategory()).append(")")
                .append(" nulls=").append(p.getNullCount())
                .append(" (").append(p.getNullPercentage() == null ? "n/a" : String.format("%.2f%%", p.getNullPercentage()))
                .append(')');
        switch (p.getCategory()) {
            case NUMERIC -> sb.append(" min=").append(p.getMinValue()).append(" max=").append(p.getMaxValue())
                    .append(" mean=").append(p.getMean()).append(" median=").append(p.getMedian());
            case STRING -> sb.append(" length=").append(p.getMinLength()).append("..").append(p.getMaxLength())
                    .append(" distinct=").append(p.getDistinctCount());
            case TEMPORAL -> sb.append(" range=").append(p.getMinValue()).append("..").append(p.getMaxValue())
                    .append(" spanDays=").append(p.getSpanDays());
            case UNKNOWN -> {
                // nothing beyond null counts
            }
        }
        return sb.toString();
    }

    private static String formatRow(Map<String, Object> row) {
        return row.toString();
    }
}
