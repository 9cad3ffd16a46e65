package com.di.tablerecon.drift;

import com.di.tablerecon.schema.ColumnDescriptor;

import java.util.List;

/**
 * Column set of several sources merged under the first-seen-wins rule.
 *
 * @param sourceNames sources in merge order
 * @param columns     merged columns, renumbered in first-seen order
 * @param conflicts   recurring columns whose later descriptor differed
 */
public record MergedColumns(List<String> sourceNames, List<ColumnDescriptor> columns,
                            List<ColumnConflict> conflicts) {

    public MergedColumns {
        sourceNames = List.copyOf(sourceNames);
        columns = List.copyOf(columns);
        conflicts = List.copyOf(conflicts);
    }

    /** Label used as the {@code before} side of a drift check. */
    public String label() {
        return sourceNames.size() == 1 ? sourceNames.get(0) : String.join(" + ", sourceNames);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
