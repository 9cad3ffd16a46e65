package com.di.tablerecon.drift;

import com.di.tablerecon.schema.ColumnDescriptor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A column that recurs across sources with a differing descriptor. The first-seen
 * descriptor was kept; the later one is recorded here.
 *
 * @param columnName    column name as first seen
 * @param keptFrom      source whose descriptor was kept
 * @param kept          kept descriptor
 * @param conflictingFrom source carrying the differing descriptor
 * @param conflicting   differing descriptor
 * @param differences   attributes that differ
 */
public record ColumnConflict(String columnName, String keptFrom, ColumnDescriptor kept,
                             String conflictingFrom, ColumnDescriptor conflicting,
                             Set<ChangedField> differences) {

    public ColumnConflict {
        differences = differences == null || differences.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ChangedField.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(differences));
    }

    public String describe() {
        return String.format("%s: kept %s from %s, %s has %s", columnName, kept, keptFrom,
                conflictingFrom, conflicting);
    }
}
