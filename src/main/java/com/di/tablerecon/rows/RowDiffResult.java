package com.di.tablerecon.rows;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Directional coverage of one source against the target: source rows whose key-tuple
 * has no equal key-tuple in the target.
 */
@Value
@Builder
public class RowDiffResult {

    String sourceName;
    String targetName;
    List<String> keyColumns;

    /** Source rows (not distinct keys) without a matching target row. */
    long missingCount;

    /** Full source rows ordered by key, at most the configured sample limit. */
    List<Map<String, Object>> sampleMissingRows;

    public boolean hasMissingRows() {
        return missingCount > 0;
    }
}
