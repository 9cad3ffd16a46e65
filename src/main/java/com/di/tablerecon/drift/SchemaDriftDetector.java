package com.di.tablerecon.drift;

import com.di.tablerecon.schema.ColumnDescriptor;
import com.di.tablerecon.schema.SchemaSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies columns of two snapshots as added, removed or changed, matching by name only.
 * A rename shows up as one removal plus one addition.
 */
@Slf4j
public class SchemaDriftDetector {

    public SchemaDiff diff(SchemaSnapshot before, SchemaSnapshot after) {
        return diff(before.dataset().qualifiedName(), before.columns(),
                after.dataset().qualifiedName(), after.columns());
    }

    public SchemaDiff diff(String beforeName, List<ColumnDescriptor> before,
                           String afterName, List<ColumnDescriptor> after) {
        Map<String, ColumnDescriptor> beforeByName = index(before);
        Map<String, ColumnDescriptor> afterByName = index(after);

        List<ColumnDescriptor> added = new ArrayList<>();
        List<ColumnDescriptor> removed = new ArrayList<>();
        List<ColumnChange> changed = new ArrayList<>();

        for (Map.Entry<String, ColumnDescriptor> entry : beforeByName.entrySet()) {
            ColumnDescriptor previous = entry.getValue();
            ColumnDescriptor current = afterByName.get(entry.getKey());
            if (current == null) {
                removed.add(previous);
                continue;
            }
            Set<ChangedField> fields = changedFields(previous, current);
            if (!fields.isEmpty()) {
                changed.add(new ColumnChange(previous.name(), previous, current, fields));
            }
        }
        for (Map.Entry<String, ColumnDescriptor> entry : afterByName.entrySet()) {
            if (!beforeByName.containsKey(entry.getKey())) {
                added.add(entry.getValue());
            }
        }

        List<String> requiredBefore = before.stream()
                .filter(c -> !c.nullable())
                .map(ColumnDescriptor::name)
                .toList();

        log.info("[SCHEMA] {} -> {}: {} added, {} removed, {} changed",
                beforeName, afterName, added.size(), removed.size(), changed.size());
        return new SchemaDiff(beforeName, afterName, added, removed, changed, requiredBefore);
    }

    static Set<ChangedField> changedFields(ColumnDescriptor before, ColumnDescriptor after) {
        Set<ChangedField> fields = EnumSet.noneOf(ChangedField.class);
        if (!before.sameType(after)) {
            fields.add(ChangedField.TYPE);
        }
        if (!Objects.equals(before.maxLength(), after.maxLength())) {
            fields.add(ChangedField.LENGTH);
        }
        if (before.nullable() != after.nullable()) {
            fields.add(ChangedField.NULLABLE);
        }
        return fields;
    }

    /** First occurrence of a name wins; ordinal order is kept. */
    private static Map<String, ColumnDescriptor> index(List<ColumnDescriptor> columns) {
        Map<String, ColumnDescriptor> byName = new LinkedHashMap<>();
        for (ColumnDescriptor column : columns) {
            byName.putIfAbsent(column.normalizedName(), column);
        }
        return byName;
    }
}
