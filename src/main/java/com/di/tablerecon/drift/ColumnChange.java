package com.di.tablerecon.drift;

import com.di.tablerecon.schema.ColumnDescriptor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A column present in both snapshots whose type, length or nullability differs.
 */
public record ColumnChange(String name, ColumnDescriptor before, ColumnDescriptor after,
                           Set<ChangedField> changedFields) {

    public ColumnChange {
        changedFields = changedFields == null || changedFields.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ChangedField.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(changedFields));
    }

    public boolean changed(ChangedField field) {
        return changedFields.contains(field);
    }

    /** e.g. {@code amount: type integer -> bigint, nullable true -> false}. */
    public String describe() {
        StringBuilder sb = new StringBuilder(name).append(':');
        String separator = " ";
        for (ChangedField field : changedFields) {
            sb.append(separator);
            switch (field) {
                case TYPE -> sb.append("type ").append(before.declaredType()).append(" -> ").append(after.declaredType());
                case LENGTH -> sb.append("length ").append(before.maxLength()).append(" -> ").append(after.maxLength());
                case NULLABLE -> sb.append("nullable ").append(before.nullable()).append(" -> ").append(after.nullable());
            }
            separator = ", ";
        }
        return sb.toString();
    }
}
