package com.di.tablerecon.rows;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Key-tuples that occur more than once in one dataset.
 */
@Value
@Builder
public class DuplicateKeyResult {

    String datasetName;
    List<String> keyColumns;

    /** Distinct key-tuples occurring more than once. */
    long duplicateKeyCount;

    /** Rows carrying a duplicated key-tuple. */
    long totalDuplicateRows;

    long maxOccurrences;

    /** Key values plus an {@code occurrences} entry, most frequent first. */
    List<Map<String, Object>> samples;

    public boolean hasDuplicates() {
        return duplicateKeyCount > 0;
    }
}
