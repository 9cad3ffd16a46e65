package com.di.tablerecon.rows;

import com.di.tablerecon.dataset.QueryExecutor;
import com.di.tablerecon.exception.EmptyKeySetException;
import com.di.tablerecon.exception.QueryExecutionException;
import com.di.tablerecon.key.KeySet;
import com.di.tablerecon.schema.SchemaSnapshot;
import com.di.tablerecon.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.tablerecon.util.SqlIdentifiers.columnList;
import static com.di.tablerecon.util.SqlIdentifiers.table;

/**
 * Finds key-tuples that occur more than once in a dataset. Key inference never checks this,
 * so inferred composite keys should be verified here before coverage results are trusted.
 */
@Slf4j
public class KeyUniquenessChecker {

    public static final int DEFAULT_SAMPLE_LIMIT = 10;

    /** Alias of the per-key occurrence count in sample rows. */
    public static final String OCCURRENCES = "occurrences";

    private final QueryExecutor queryExecutor;
    private final int sampleLimit;

    public KeyUniquenessChecker(QueryExecutor queryExecutor) {
        this(queryExecutor, DEFAULT_SAMPLE_LIMIT);
    }

    public KeyUniquenessChecker(QueryExecutor queryExecutor, int sampleLimit) {
        this.queryExecutor = queryExecutor;
        this.sampleLimit = InputValidator.validateSampleLimit(sampleLimit);
    }

    public DuplicateKeyResult findDuplicates(SchemaSnapshot dataset, KeySet keys) {
        String context = dataset.dataset().qualifiedName();
        if (keys == null) {
            throw new EmptyKeySetException(context);
        }
        List<String> keyColumns = keys.resolveAgainst(dataset);
        String keyList = columnList("d", keyColumns);
        String grouped = "SELECT " + keyList + ", COUNT(*) AS dup_occurrences FROM " + table(dataset.dataset())
                + " d GROUP BY " + keyList + " HAVING COUNT(*) > 1";

        Map<String, Object> summary;
        List<Map<String, Object>> sampleRows;
        try {
            summary = queryExecutor.queryForRow(context,
                    "SELECT COUNT(*) AS duplicate_key_count, "
                            + "COALESCE(SUM(g.dup_occurrences), 0) AS total_duplicate_rows, "
                            + "COALESCE(MAX(g.dup_occurrences), 0) AS max_occurrences "
                            + "FROM (" + grouped + ") g");
            long duplicates = RowReconciliationEngine.asLong(summary.get("duplicate_key_count"));
            sampleRows = duplicates == 0 ? List.of() : queryExecutor.queryForRows(context,
                    grouped + " ORDER BY dup_occurrences DESC, " + keyList + " LIMIT " + sampleLimit);
        } catch (QueryExecutionException e) {
            throw e.withContext(null, keys.columns());
        }

        List<Map<String, Object>> samples = sampleRows.stream()
                .map(row -> toSample(row, keyColumns))
                .toList();

        DuplicateKeyResult result = DuplicateKeyResult.builder()
                .datasetName(context)
                .keyColumns(keys.columns())
                .duplicateKeyCount(RowReconciliationEngine.asLong(summary.get("duplicate_key_count")))
                .totalDuplicateRows(RowReconciliationEngine.asLong(summary.get("total_duplicate_rows")))
                .maxOccurrences(RowReconciliationEngine.asLong(summary.get("max_occurrences")))
                .samples(samples)
                .build();

        if (result.hasDuplicates()) {
            log.warn("[KEYS] {} has {} duplicated key-tuples on {} ({} rows, max {} occurrences)",
                    context, result.getDuplicateKeyCount(), keys.columns(),
                    result.getTotalDuplicateRows(), result.getMaxOccurrences());
        } else {
            log.info("[KEYS] {} is unique on {}", context, keys.columns());
        }
        return result;
    }

    private static Map<String, Object> toSample(Map<String, Object> row, List<String> keyColumns) {
        Map<String, Object> sample = new LinkedHashMap<>();
        for (String key : keyColumns) {
            sample.put(key, row.get(key));
        }
        sample.put(OCCURRENCES, RowReconciliationEngine.asLong(row.get("dup_occurrences")));
        return Collections.unmodifiableMap(sample);
    }
}
