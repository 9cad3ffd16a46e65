package com.di.tablerecon.rows;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Coverage of the union of all source key-tuples against the target.
 */
@Value
@Builder
public class UnionCoverageResult {

    List<String> sourceNames;
    String targetName;
    List<String> keyColumns;

    /** Distinct key-tuples of the union with no matching target key-tuple. */
    long missingKeyCount;

    /** Key-tuples ordered by key, keyed by key column name. */
    List<Map<String, Object>> sampleMissingKeys;

    public boolean hasMissingKeys() {
        return missingKeyCount > 0;
    }
}
