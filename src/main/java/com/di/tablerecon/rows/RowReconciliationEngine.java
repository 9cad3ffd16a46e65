package com.di.tablerecon.rows;

import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.dataset.QueryExecutor;
import com.di.tablerecon.exception.ColumnNotFoundException;
import com.di.tablerecon.exception.EmptyKeySetException;
import com.di.tablerecon.exception.QueryExecutionException;
import com.di.tablerecon.key.KeySet;
import com.di.tablerecon.schema.ColumnDescriptor;
import com.di.tablerecon.schema.SchemaCapture;
import com.di.tablerecon.schema.SchemaIntrospector;
import com.di.tablerecon.schema.SchemaSnapshot;
import com.di.tablerecon.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.di.tablerecon.util.SqlIdentifiers.column;
import static com.di.tablerecon.util.SqlIdentifiers.columnList;
import static com.di.tablerecon.util.SqlIdentifiers.equiJoin;
import static com.di.tablerecon.util.SqlIdentifiers.quote;
import static com.di.tablerecon.util.SqlIdentifiers.table;

/**
 * Key-based coverage between datasets, pushed down to the warehouse as {@code NOT EXISTS} anti-joins.
 * <p>
 * Keys match under ordinary SQL equality, so a NULL key value never matches. Coverage is
 * directional: {@code reconcile(a, b)} says nothing about rows of {@code b} missing from {@code a}.
 * Key columns are resolved against each dataset's own spelling; an authoritative snapshot without
 * a key column fails the comparison with {@code KeyColumnNotFoundException}.
 */
@Slf4j
public class RowReconciliationEngine {

    public static final int DEFAULT_SAMPLE_LIMIT = 5;

    /** Types without a sort order in the warehouse; they cannot break ties in sample ordering. */
    private static final Set<String> UNORDERABLE_TYPES = Set.of(
            "json", "xml", "point", "line", "lseg", "box", "path", "polygon", "circle");

    private final QueryExecutor queryExecutor;
    private final SchemaIntrospector introspector;
    private final int sampleLimit;

    public RowReconciliationEngine(QueryExecutor queryExecutor, SchemaIntrospector introspector) {
        this(queryExecutor, introspector, DEFAULT_SAMPLE_LIMIT);
    }

    public RowReconciliationEngine(QueryExecutor queryExecutor, SchemaIntrospector introspector, int sampleLimit) {
        this.queryExecutor = queryExecutor;
        this.introspector = introspector;
        this.sampleLimit = InputValidator.validateSampleLimit(sampleLimit);
    }

    /* ------------------------------------------------------------------ */
    /* Source -> target                                                    */
    /* ------------------------------------------------------------------ */

    public RowDiffResult reconcile(DatasetHandle source, DatasetHandle target, KeySet keys) {
        requireKeys(keys, source + " -> " + target);
        return reconcile(capture(source, keys), capture(target, keys), keys);
    }

    /**
     * Counts source rows with no key-equal target row and samples them.
     */
    public RowDiffResult reconcile(SchemaSnapshot source, SchemaSnapshot target, KeySet keys) {
        String context = source.dataset() + " -> " + target.dataset();
        requireKeys(keys, context);
        List<String> sourceKeys = keys.resolveAgainst(source);
        List<String> targetKeys = keys.resolveAgainst(target);

        String fromMissing = " FROM " + table(source.dataset()) + " s WHERE "
                + notExists("s", sourceKeys, target, targetKeys);

        long missing;
        List<Map<String, Object>> samples;
        try {
            missing = queryExecutor.queryForLong(context, "SELECT COUNT(*)" + fromMissing);
            samples = missing == 0 ? List.of() : queryExecutor.queryForRows(context,
                    "SELECT s.*" + fromMissing + " ORDER BY " + columnList("s", sampleOrder(source, sourceKeys))
                            + limit());
        } catch (QueryExecutionException e) {
            throw e.withContext(null, keys.columns());
        }

        log.info("[ROWS] {} -> {} on {}: {} missing rows", source.dataset(), target.dataset(),
                keys.columns(), missing);
        return RowDiffResult.builder()
                .sourceName(source.dataset().qualifiedName())
                .targetName(target.dataset().qualifiedName())
                .keyColumns(keys.columns())
                .missingCount(missing)
                .sampleMissingRows(copyRows(samples))
                .build();
    }

    /* ------------------------------------------------------------------ */
    /* Union of sources -> target                                          */
    /* ------------------------------------------------------------------ */

    public UnionCoverageResult reconcileUnion(List<DatasetHandle> sources, DatasetHandle target, KeySet keys) {
        requireKeys(keys, sources + " -> " + target);
        List<SchemaSnapshot> sourceSnapshots = sources.stream().map(s -> capture(s, keys)).toList();
        return reconcileUnion(sourceSnapshots, capture(target, keys), keys);
    }

    /**
     * Counts distinct key-tuples of the union of all sources that have no key-equal target row.
     */
    public UnionCoverageResult reconcileUnion(List<SchemaSnapshot> sources, SchemaSnapshot target, KeySet keys) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("Union coverage requires at least one source");
        }
        List<String> sourceNames = sources.stream().map(s -> s.dataset().qualifiedName()).toList();
        String context = sourceNames + " -> " + target.dataset();
        requireKeys(keys, context);

        List<String> unionKeys = keys.columns();
        List<String> branches = new ArrayList<>();
        for (SchemaSnapshot source : sources) {
            List<String> sourceKeys = keys.resolveAgainst(source);
            List<String> projections = new ArrayList<>();
            for (int i = 0; i < sourceKeys.size(); i++) {
                projections.add(column("s", sourceKeys.get(i)) + " AS " + quote(unionKeys.get(i)));
            }
            branches.add("SELECT " + String.join(", ", projections) + " FROM " + table(source.dataset()) + " s");
        }
        List<String> targetKeys = keys.resolveAgainst(target);

        String withUnion = "WITH source_keys AS (" + String.join(" UNION ", branches) + ") ";
        String fromMissing = " FROM source_keys u WHERE " + notExists("u", unionKeys, target, targetKeys);

        long missing;
        List<Map<String, Object>> samples;
        try {
            missing = queryExecutor.queryForLong(context, withUnion + "SELECT COUNT(*)" + fromMissing);
            samples = missing == 0 ? List.of() : queryExecutor.queryForRows(context,
                    withUnion + "SELECT " + columnList("u", unionKeys) + fromMissing
                            + " ORDER BY " + columnList("u", unionKeys) + limit());
        } catch (QueryExecutionException e) {
            throw e.withContext(null, keys.columns());
        }

        log.info("[UNION] {} sources -> {} on {}: {} missing keys", sources.size(), target.dataset(),
                keys.columns(), missing);
        return UnionCoverageResult.builder()
                .sourceNames(sourceNames)
                .targetName(target.dataset().qualifiedName())
                .keyColumns(keys.columns())
                .missingKeyCount(missing)
                .sampleMissingKeys(copyRows(samples))
                .build();
    }

    /* ------------------------------------------------------------------ */
    /* Old version -> new version                                          */
    /* ------------------------------------------------------------------ */

    public VersionComparisonResult compareVersions(DatasetHandle oldVersion, DatasetHandle newVersion,
                                                   KeySet keys, List<String> columns) {
        requireKeys(keys, oldVersion + " -> " + newVersion);
        return compareVersions(capture(oldVersion, keys), capture(newVersion, keys), keys, columns);
    }

    /**
     * Record counts both ways plus per-column value agreement over key-matched rows.
     *
     * @param columns non-key columns to compare; null or empty compares every common non-key column
     */
    public VersionComparisonResult compareVersions(SchemaSnapshot oldVersion, SchemaSnapshot newVersion,
                                                   KeySet keys, List<String> columns) {
        String context = oldVersion.dataset() + " -> " + newVersion.dataset();
        requireKeys(keys, context);
        List<String> oldKeys = keys.resolveAgainst(oldVersion);
        List<String> newKeys = keys.resolveAgainst(newVersion);

        long oldCount;
        long newCount;
        long oldNotInNew;
        long newNotInOld;
        try {
            oldCount = queryExecutor.queryForLong(context, "SELECT COUNT(*) FROM " + table(oldVersion.dataset()));
            newCount = queryExecutor.queryForLong(context, "SELECT COUNT(*) FROM " + table(newVersion.dataset()));
            oldNotInNew = queryExecutor.queryForLong(context, "SELECT COUNT(*) FROM " + table(oldVersion.dataset())
                    + " s WHERE " + notExists("s", oldKeys, newVersion, newKeys));
            newNotInOld = queryExecutor.queryForLong(context, "SELECT COUNT(*) FROM " + table(newVersion.dataset())
                    + " s WHERE " + notExists("s", newKeys, oldVersion, oldKeys));
        } catch (QueryExecutionException e) {
            throw e.withContext(null, keys.columns());
        }

        List<ColumnValueComparison> comparisons = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String requested : comparedColumns(oldVersion, newVersion, keys, columns)) {
            Optional<String> oldColumn = resolveColumn(oldVersion, requested, failed);
            Optional<String> newColumn = resolveColumn(newVersion, requested, failed);
            if (oldColumn.isEmpty() || newColumn.isEmpty()) {
                continue;
            }
            try {
                comparisons.add(compareColumn(context, oldVersion, oldKeys, oldColumn.get(),
                        newVersion, newKeys, newColumn.get()));
            } catch (QueryExecutionException e) {
                log.warn("[ROWS] Value comparison of {} failed for {}: {}", requested, context, e.getMessage());
                failed.put(requested, e.getMessage());
            }
        }

        long difference = Math.abs(newCount - oldCount);
        Double percentage = oldCount == 0 ? null
                : BigDecimal.valueOf(difference * 100.0 / oldCount).setScale(2, RoundingMode.HALF_UP).doubleValue();

        log.info("[ROWS] Version comparison {}: old={} new={} oldOnly={} newOnly={} changedColumns={}",
                context, oldCount, newCount, oldNotInNew, newNotInOld,
                comparisons.stream().filter(ColumnValueComparison::hasDifferences).count());

        return VersionComparisonResult.builder()
                .oldName(oldVersion.dataset().qualifiedName())
                .newName(newVersion.dataset().qualifiedName())
                .keyColumns(keys.columns())
                .oldRecordCount(oldCount)
                .newRecordCount(newCount)
                .recordsInOldNotInNew(oldNotInNew)
                .recordsInNewNotInOld(newNotInOld)
                .recordCountDifference(difference)
                .percentageChange(percentage)
                .columnValueComparisons(List.copyOf(comparisons))
                .failedColumns(Collections.unmodifiableMap(failed))
                .build();
    }

    private ColumnValueComparison compareColumn(String context,
                                                SchemaSnapshot oldVersion, List<String> oldKeys, String oldColumn,
                                                SchemaSnapshot newVersion, List<String> newKeys, String newColumn) {
        String o = column("o", oldColumn);
        String n = column("n", newColumn);
        String sql = "SELECT "
                + "SUM(CASE WHEN " + o + " = " + n + " OR (" + o + " IS NULL AND " + n + " IS NULL) THEN 1 ELSE 0 END) AS same_count, "
                + "SUM(CASE WHEN " + o + " <> " + n + " THEN 1 ELSE 0 END) AS different_count, "
                + "SUM(CASE WHEN " + o + " IS NULL AND " + n + " IS NOT NULL THEN 1 ELSE 0 END) AS null_to_value_count, "
                + "SUM(CASE WHEN " + o + " IS NOT NULL AND " + n + " IS NULL THEN 1 ELSE 0 END) AS value_to_null_count "
                + "FROM " + table(oldVersion.dataset()) + " o "
                + "JOIN " + table(newVersion.dataset()) + " n ON " + equiJoin("o", oldKeys, "n", newKeys);
        try {
            Map<String, Object> row = queryExecutor.queryForRow(context, sql);
            return ColumnValueComparison.builder()
                    .columnName(oldColumn)
                    .sameCount(asLong(row.get("same_count")))
                    .differentCount(asLong(row.get("different_count")))
                    .nullToValueCount(asLong(row.get("null_to_value_count")))
                    .valueToNullCount(asLong(row.get("value_to_null_count")))
                    .build();
        } catch (QueryExecutionException e) {
            throw e.withContext(oldColumn, oldKeys);
        }
    }

    private static List<String> comparedColumns(SchemaSnapshot oldVersion, SchemaSnapshot newVersion,
                                                KeySet keys, List<String> requested) {
        if (requested != null && !requested.isEmpty()) {
            return requested.stream().filter(c -> !keys.contains(c)).toList();
        }
        return oldVersion.columns().stream()
                .map(ColumnDescriptor::name)
                .filter(c -> !keys.contains(c))
                .filter(newVersion::contains)
                .toList();
    }

    private static Optional<String> resolveColumn(SchemaSnapshot snapshot, String column, Map<String, String> failed) {
        Optional<ColumnDescriptor> match = snapshot.find(column);
        if (match.isPresent()) {
            return Optional.of(match.get().name());
        }
        if (!snapshot.authoritative()) {
            return Optional.of(InputValidator.validateColumnName(column));
        }
        failed.putIfAbsent(column, new ColumnNotFoundException(snapshot.dataset().qualifiedName(), column).getMessage());
        return Optional.empty();
    }

    /* ------------------------------------------------------------------ */
    /* Helpers                                                             */
    /* ------------------------------------------------------------------ */

    /** {@code NOT EXISTS (SELECT 1 FROM target t WHERE outer.k = t.k ...)}. */
    private static String notExists(String outerAlias, List<String> outerKeys,
                                    SchemaSnapshot target, List<String> targetKeys) {
        return "NOT EXISTS (SELECT 1 FROM " + table(target.dataset()) + " t WHERE "
                + equiJoin(outerAlias, outerKeys, "t", targetKeys) + ")";
    }

    /**
     * Key columns first, then the remaining orderable columns of an authoritative snapshot, so
     * tied key-tuples still sample the same rows on every run.
     */
    static List<String> sampleOrder(SchemaSnapshot dataset, List<String> keyColumns) {
        List<String> order = new ArrayList<>(keyColumns);
        if (!dataset.authoritative()) {
            return order;
        }
        for (ColumnDescriptor descriptor : dataset.columns()) {
            boolean isKey = keyColumns.stream().anyMatch(descriptor::hasName);
            if (!isKey && !UNORDERABLE_TYPES.contains(descriptor.declaredType().toLowerCase(Locale.ROOT))) {
                order.add(descriptor.name());
            }
        }
        return order;
    }

    private String limit() {
        return " LIMIT " + sampleLimit;
    }

    private SchemaSnapshot capture(DatasetHandle dataset, KeySet keys) {
        SchemaCapture capture = SchemaCapture.capture(introspector, dataset, keys.columns());
        if (capture.fellBack()) {
            log.warn("[ROWS] Using key columns as fallback schema for {}: {}", dataset, capture.failure().getMessage());
        }
        return capture.snapshot();
    }

    private static void requireKeys(KeySet keys, String context) {
        if (keys == null) {
            throw new EmptyKeySetException(context);
        }
    }

    static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }

    private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
        return rows.stream()
                .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
                .toList();
    }
}
