package com.di.tablerecon.drift;

import com.di.tablerecon.schema.ColumnDescriptor;
import com.di.tablerecon.schema.SchemaSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the columns of several source snapshots into one column set.
 * <p>
 * When a column name recurs, the descriptor of the first source that declared it is kept.
 * A later descriptor that differs in type, length or nullability is never applied; it is
 * recorded as a {@link ColumnConflict}.
 */
@Slf4j
public class SourceColumnMerger {

    public MergedColumns merge(List<SchemaSnapshot> sources) {
        Map<String, ColumnDescriptor> merged = new LinkedHashMap<>();
        Map<String, String> origin = new LinkedHashMap<>();
        List<ColumnConflict> conflicts = new ArrayList<>();

        for (SchemaSnapshot source : sources) {
            String sourceName = source.dataset().qualifiedName();
            for (ColumnDescriptor column : source.columns()) {
                String key = column.normalizedName();
                ColumnDescriptor kept = merged.get(key);
                if (kept == null) {
                    merged.put(key, new ColumnDescriptor(column.name(), column.declaredType(), column.maxLength(),
                            column.nullable(), merged.size() + 1));
                    origin.put(key, sourceName);
                    continue;
                }
                Set<ChangedField> differences = SchemaDriftDetector.changedFields(kept, column);
                if (!differences.isEmpty()) {
                    ColumnConflict conflict = new ColumnConflict(kept.name(), origin.get(key), kept,
                            sourceName, column, differences);
                    log.warn("[SCHEMA] Column conflict {}", conflict.describe());
                    conflicts.add(conflict);
                }
            }
        }

        return new MergedColumns(sources.stream().map(s -> s.dataset().qualifiedName()).toList(),
                new ArrayList<>(merged.values()), conflicts);
    }
}
