package com.di.tablerecon.drift;

import com.di.tablerecon.schema.ColumnDescriptor;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Column-level drift between a {@code before} and an {@code after} column set.
 *
 * @param beforeName     label of the before side (dataset name, or merged source names)
 * @param afterName      label of the after side
 * @param added          columns only in {@code after}, in its ordinal order
 * @param removed        columns only in {@code before}, in its ordinal order
 * @param changed        columns in both whose type, length or nullability differ
 * @param requiredBefore columns declared NOT NULL on the before side
 */
public record SchemaDiff(String beforeName, String afterName,
                         List<ColumnDescriptor> added, List<ColumnDescriptor> removed,
                         List<ColumnChange> changed, List<String> requiredBefore) {

    public SchemaDiff {
        added = added == null ? List.of() : List.copyOf(added);
        removed = removed == null ? List.of() : List.copyOf(removed);
        changed = changed == null ? List.of() : List.copyOf(changed);
        requiredBefore = requiredBefore == null ? List.of() : List.copyOf(requiredBefore);
    }

    public boolean hasDrift() {
        return !added.isEmpty() || !removed.isEmpty() || !changed.isEmpty();
    }

    public List<String> addedNames() {
        return added.stream().map(ColumnDescriptor::name).toList();
    }

    public List<String> removedNames() {
        return removed.stream().map(ColumnDescriptor::name).toList();
    }

    public List<String> changedNames() {
        return changed.stream().map(ColumnChange::name).toList();
    }

    /**
     * Removed or changed columns whose name (case-insensitive) is in {@code columns}.
     */
    public Set<String> removedOrChangedAmong(Collection<String> columns) {
        Set<String> wanted = columns.stream()
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        Set<String> hits = new LinkedHashSet<>();
        removed.stream().map(ColumnDescriptor::name)
                .filter(n -> wanted.contains(n.toLowerCase(Locale.ROOT)))
                .forEach(hits::add);
        changed.stream().map(ColumnChange::name)
                .filter(n -> wanted.contains(n.toLowerCase(Locale.ROOT)))
                .forEach(hits::add);
        return hits;
    }
}
