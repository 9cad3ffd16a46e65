package com.di.tablerecon.profile;

import com.di.tablerecon.dataset.QueryExecutor;
import com.di.tablerecon.exception.ColumnNotFoundException;
import com.di.tablerecon.exception.QueryExecutionException;
import com.di.tablerecon.exception.ReconciliationException;
import com.di.tablerecon.report.ComparisonFailure;
import com.di.tablerecon.report.ReconciliationStep;
import com.di.tablerecon.schema.ColumnDescriptor;
import com.di.tablerecon.schema.SchemaSnapshot;
import com.di.tablerecon.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.di.tablerecon.util.SqlIdentifiers.column;
import static com.di.tablerecon.util.SqlIdentifiers.table;

/**
 * Per-column statistics and grouped aggregates, computed in the warehouse.
 * <p>
 * Every column is profiled by its own query so one failing column does not hide the others.
 * A column absent from an authoritative snapshot is reported as {@code COLUMN_NOT_FOUND}.
 * All methods accept an optional {@link ProfileWindow}; null profiles the whole dataset.
 */
@Slf4j
public class AggregateProfiler {

    private final QueryExecutor queryExecutor;

    public AggregateProfiler(QueryExecutor queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    /* ------------------------------------------------------------------ */
    /* Column profiles                                                     */
    /* ------------------------------------------------------------------ */

    public ProfileResult profile(SchemaSnapshot dataset, List<ColumnSpec> columns) {
        return profile(dataset, columns, null);
    }

    /** Profiles every column of the snapshot, categorized by declared type. */
    public ProfileResult profileAll(SchemaSnapshot dataset, ProfileWindow window) {
        return profile(dataset, dataset.columnNames().stream().map(ColumnSpec::of).toList(), window);
    }

    /**
     * @throws QueryExecutionException when the dataset's row count cannot be queried
     */
    public ProfileResult profile(SchemaSnapshot dataset, List<ColumnSpec> columns, ProfileWindow window) {
        String datasetName = dataset.dataset().qualifiedName();
        Filter filter = filter(dataset, window);
        long totalRows = queryExecutor.queryForLong(datasetName,
                "SELECT COUNT(*) FROM " + table(dataset.dataset()) + " d" + filter.sql(), filter.args());

        List<ColumnProfile> profiles = new ArrayList<>();
        List<ComparisonFailure> failures = new ArrayList<>();
        for (ColumnSpec spec : columns) {
            try {
                profiles.add(profileColumn(dataset, spec, totalRows, filter));
            } catch (ReconciliationException e) {
                log.warn("[PROFILE] {}.{} could not be profiled: {}", datasetName, spec.name(), e.getMessage());
                failures.add(ComparisonFailure.of(ReconciliationStep.PROFILE, e));
            } catch (RuntimeException e) {
                log.warn("[PROFILE] {}.{} returned values that could not be read: {}", datasetName, spec.name(),
                        e.toString(), e);
                failures.add(ComparisonFailure.of(ReconciliationStep.PROFILE, new QueryExecutionException(
                        datasetName, spec.name(), null,
                        String.format("Profile of '%s.%s' could not be read: %s", datasetName, spec.name(), e),
                        false, e)));
            }
        }

        log.info("[PROFILE] {} profiled {} of {} columns over {} rows{}", datasetName, profiles.size(),
                columns.size(), totalRows, window == null ? "" : " (window " + window + ")");
        return ProfileResult.builder()
                .datasetName(datasetName)
                .totalRows(totalRows)
                .window(window)
                .profiles(List.copyOf(profiles))
                .failures(List.copyOf(failures))
                .build();
    }

    private ColumnProfile profileColumn(SchemaSnapshot dataset, ColumnSpec spec, long totalRows, Filter filter) {
        String datasetName = dataset.dataset().qualifiedName();
        Optional<ColumnDescriptor> descriptor = dataset.find(spec.name());
        String columnName = resolveColumn(dataset, spec.name());
        String declaredType = descriptor.map(ColumnDescriptor::declaredType).orElse(ColumnDescriptor.UNKNOWN_TYPE);
        ColumnCategory category = spec.category() != null ? spec.category() : ColumnCategory.fromDeclaredType(declaredType);

        String c = column("d", columnName);
        String select = switch (category) {
            case NUMERIC -> "COUNT(" + c + ") AS non_null_count, MIN(" + c + ") AS min_value, MAX(" + c + ") AS max_value, "
                    + "AVG(" + c + ") AS mean_value, PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY " + c + ") AS median_value";
            case STRING -> "COUNT(" + c + ") AS non_null_count, "
                    + "MIN(LENGTH(CAST(" + c + " AS VARCHAR))) AS min_length, "
                    + "MAX(LENGTH(CAST(" + c + " AS VARCHAR))) AS max_length, "
                    + "AVG(LENGTH(CAST(" + c + " AS VARCHAR))) AS avg_length, "
                    + "COUNT(DISTINCT " + c + ") AS distinct_count";
            case TEMPORAL -> "COUNT(" + c + ") AS non_null_count, MIN(" + c + ") AS min_value, MAX(" + c + ") AS max_value";
            case UNKNOWN -> "COUNT(" + c + ") AS non_null_count";
        };

        Map<String, Object> row;
        try {
            row = queryExecutor.queryForRow(datasetName,
                    "SELECT " + select + " FROM " + table(dataset.dataset()) + " d" + filter.sql(), filter.args());
        } catch (QueryExecutionException e) {
            throw e.withContext(columnName, null);
        }

        long nonNull = asLong(row.get("non_null_count"));
        long nullCount = Math.max(0, totalRows - nonNull);
        ColumnProfile.ColumnProfileBuilder builder = ColumnProfile.builder()
                .columnName(columnName)
                .category(category)
                .declaredType(declaredType)
                .totalRows(totalRows)
                .nonNullCount(nonNull)
                .nullCount(nullCount)
                .nullPercentage(ColumnProfile.nullPercentage(nullCount, totalRows));

        switch (category) {
            case NUMERIC -> builder
                    .minValue(numericOrRaw(row.get("min_value")))
                    .maxValue(numericOrRaw(row.get("max_value")))
                    .mean(asDouble(row.get("mean_value")))
                    .median(asDouble(row.get("median_value")));
            case STRING -> builder
                    .minLength(asInteger(row.get("min_length")))
                    .maxLength(asInteger(row.get("max_length")))
                    .avgLength(asDouble(row.get("avg_length")))
                    .distinctCount(asLong(row.get("distinct_count")));
            case TEMPORAL -> {
                Object min = TemporalValues.normalize(row.get("min_value"));
                Object max = TemporalValues.normalize(row.get("max_value"));
                builder.minValue(min).maxValue(max).spanDays(TemporalValues.spanDays(min, max));
            }
            case UNKNOWN -> {
                // null counts only
            }
        }
        return builder.build();
    }

    /* ------------------------------------------------------------------ */
    /* Grouped aggregation                                                 */
    /* ------------------------------------------------------------------ */

    /**
     * Per-group row count, measure null rate and the requested statistics, ordered by the first
     * statistic descending, then row count descending, then group value ascending (nulls last).
     *
     * @param measureColumn column the statistics apply to; null allows row counts only
     */
    public List<GroupAggregate> aggregateBy(SchemaSnapshot dataset, String groupColumn, String measureColumn,
                                            List<AggregateStat> stats, ProfileWindow window) {
        String datasetName = dataset.dataset().qualifiedName();
        List<AggregateStat> requested = stats == null ? List.of() : stats.stream().distinct().toList();
        if (measureColumn == null && !requested.isEmpty()) {
            throw new IllegalArgumentException("Statistics " + requested + " require a measure column");
        }

        String group = column("d", resolveColumn(dataset, groupColumn));
        String measure = measureColumn == null ? null : column("d", resolveColumn(dataset, measureColumn));
        Filter filter = filter(dataset, window);

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(group).append(" AS group_value, COUNT(*) AS row_count, ")
                .append(measure == null ? "0" : "COUNT(*) - COUNT(" + measure + ")").append(" AS null_count");
        for (AggregateStat stat : requested) {
            sql.append(", ").append(stat.sql(measure)).append(" AS ").append(stat.alias());
        }
        sql.append(" FROM ").append(table(dataset.dataset())).append(" d").append(filter.sql())
           .append(" GROUP BY ").append(group)
           .append(" ORDER BY ");
        if (!requested.isEmpty()) {
            sql.append(requested.get(0).alias()).append(" DESC NULLS LAST, ");
        }
        sql.append("row_count DESC, group_value ASC NULLS LAST");

        List<Map<String, Object>> rows;
        try {
            rows = queryExecutor.queryForRows(datasetName, sql.toString(), filter.args());
        } catch (QueryExecutionException e) {
            throw e.withContext(measureColumn != null ? measureColumn : groupColumn, null);
        }

        List<GroupAggregate> groups = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            long rowCount = asLong(row.get("row_count"));
            long nullCount = asLong(row.get("null_count"));
            Map<AggregateStat, Object> values = new LinkedHashMap<>();
            for (AggregateStat stat : requested) {
                Object value = row.get(stat.alias());
                values.put(stat, stat == AggregateStat.COUNT || stat == AggregateStat.COUNT_DISTINCT
                        ? Long.valueOf(asLong(value))
                        : numericOrRaw(value));
            }
            groups.add(GroupAggregate.builder()
                    .groupValue(TemporalValues.normalize(row.get("group_value")))
                    .rowCount(rowCount)
                    .nullCount(nullCount)
                    .nullPercentage(ColumnProfile.nullPercentage(nullCount, rowCount))
                    .values(values)
                    .build());
        }
        log.info("[PROFILE] {} aggregated by {}: {} groups", datasetName, groupColumn, groups.size());
        return List.copyOf(groups);
    }

    /* ------------------------------------------------------------------ */
    /* Distribution shift                                                  */
    /* ------------------------------------------------------------------ */

    /**
     * Non-null count, distinct count and null percentage of each column on both sides.
     *
     * @param columns columns to compare; null or empty compares every column common to both
     */
    public List<ColumnShift> compareDistributions(SchemaSnapshot before, SchemaSnapshot after, List<String> columns) {
        List<String> compared = columns != null && !columns.isEmpty()
                ? columns
                : before.columnNames().stream().filter(after::contains).toList();

        List<ColumnShift> shifts = new ArrayList<>();
        for (String name : compared) {
            try {
                Map<String, Object> b = distribution(before, name);
                Map<String, Object> a = distribution(after, name);
                long beforeTotal = asLong(b.get("total_rows"));
                long afterTotal = asLong(a.get("total_rows"));
                long beforeNonNull = asLong(b.get("non_null_count"));
                long afterNonNull = asLong(a.get("non_null_count"));
                shifts.add(ColumnShift.builder()
                        .columnName(name)
                        .beforeNonNullCount(beforeNonNull)
                        .afterNonNullCount(afterNonNull)
                        .beforeDistinctCount(asLong(b.get("distinct_count")))
                        .afterDistinctCount(asLong(a.get("distinct_count")))
                        .beforeNullPercentage(ColumnProfile.nullPercentage(beforeTotal - beforeNonNull, beforeTotal))
                        .afterNullPercentage(ColumnProfile.nullPercentage(afterTotal - afterNonNull, afterTotal))
                        .build());
            } catch (ReconciliationException e) {
                log.warn("[PROFILE] Distribution of {} could not be compared: {}", name, e.getMessage());
                shifts.add(ColumnShift.builder().columnName(name).failure(e.getMessage()).build());
            }
        }
        log.info("[PROFILE] Compared distributions of {} columns: {} -> {}", shifts.size(),
                before.dataset(), after.dataset());
        return List.copyOf(shifts);
    }

    private Map<String, Object> distribution(SchemaSnapshot dataset, String name) {
        String c = column("d", resolveColumn(dataset, name));
        try {
            return queryExecutor.queryForRow(dataset.dataset().qualifiedName(),
                    "SELECT COUNT(*) AS total_rows, COUNT(" + c + ") AS non_null_count, "
                            + "COUNT(DISTINCT " + c + ") AS distinct_count FROM " + table(dataset.dataset()) + " d");
        } catch (QueryExecutionException e) {
            throw e.withContext(name, null);
        }
    }

    /* ------------------------------------------------------------------ */
    /* Date distribution                                                   */
    /* ------------------------------------------------------------------ */

    /**
     * Record counts per {@code datePart} period of a date column, ordered by period.
     */
    public DateDistribution dateDistribution(SchemaSnapshot dataset, String dateColumn, DatePart datePart,
                                             ProfileWindow window) {
        String datasetName = dataset.dataset().qualifiedName();
        String columnName = resolveColumn(dataset, dateColumn);
        String c = column("d", columnName);
        String period = "date_trunc('" + datePart.sqlName() + "', " + c + ")";
        Filter filter = filter(dataset, window);
        String where = filter.sql().isEmpty() ? " WHERE " : filter.sql() + " AND ";

        List<Map<String, Object>> rows;
        try {
            rows = queryExecutor.queryForRows(datasetName,
                    "SELECT " + period + " AS period_start, COUNT(*) AS record_count FROM " + table(dataset.dataset())
                            + " d" + where + c + " IS NOT NULL GROUP BY " + period + " ORDER BY period_start",
                    filter.args());
        } catch (QueryExecutionException e) {
            throw e.withContext(columnName, null);
        }

        List<DateDistribution.Bucket> buckets = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            LocalDate start = TemporalValues.toLocalDate(row.get("period_start"));
            if (start == null) {
                throw new QueryExecutionException(datasetName, columnName, null,
                        String.format("Column '%s' of '%s' is not a date column", columnName, datasetName), false, null);
            }
            buckets.add(new DateDistribution.Bucket(start, datePart.label(start), asLong(row.get("record_count"))));
        }
        DateDistribution distribution = DateDistribution.of(datasetName, columnName, datePart, buckets);
        log.info("[PROFILE] {}.{} by {}: {} periods, {} records", datasetName, columnName, datePart,
                distribution.getUniquePeriods(), distribution.getTotalRecords());
        return distribution;
    }

    /* ------------------------------------------------------------------ */
    /* Helpers                                                             */
    /* ------------------------------------------------------------------ */

    private record Filter(String sql, Object[] args) {
        static final Filter NONE = new Filter("", new Object[0]);
    }

    private static Filter filter(SchemaSnapshot dataset, ProfileWindow window) {
        if (window == null) {
            return Filter.NONE;
        }
        String c = column("d", resolveColumn(dataset, window.column()));
        return new Filter(" WHERE " + c + " >= ? AND " + c + " < ?", new Object[]{
                Timestamp.valueOf(window.fromInclusive()), Timestamp.valueOf(window.toExclusive())});
    }

    private static String resolveColumn(SchemaSnapshot dataset, String name) {
        Optional<ColumnDescriptor> match = dataset.find(name);
        if (match.isPresent()) {
            return match.get().name();
        }
        if (dataset.authoritative()) {
            throw new ColumnNotFoundException(dataset.dataset().qualifiedName(), name);
        }
        return InputValidator.validateColumnName(name);
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number n ? n.intValue() : null;
    }

    private static Double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static Object numericOrRaw(Object value) {
        return value instanceof Number n ? exactNumber(n) : TemporalValues.normalize(value);
    }

    /**
     * Integral values become {@link Long} (or stay {@link BigInteger} beyond its range), decimals
     * stay {@link BigDecimal} and floating-point values become {@link Double}. Nothing is rounded.
     */
    static Object exactNumber(Number n) {
        if (n instanceof BigDecimal || n instanceof Long || n instanceof Double) {
            return n;
        }
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return n.longValue();
        }
        if (n instanceof BigInteger b) {
            return b.bitLength() < Long.SIZE ? (Object) b.longValue() : b;
        }
        if (n instanceof Float f) {
            return Double.valueOf(f.toString());
        }
        return new BigDecimal(n.toString());
    }
}
