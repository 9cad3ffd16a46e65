package com.di.tablerecon.schema;

import java.util.Locale;

/**
 * One column of a dataset as reported by the catalog.
 *
 * @param name            column name as stored in the catalog
 * @param declaredType    catalog data type (e.g. {@code integer}, {@code character varying})
 * @param maxLength       character maximum length, or null when the type has none
 * @param nullable        whether the column accepts NULL
 * @param ordinalPosition 1-based position in the table
 */
public record ColumnDescriptor(String name, String declaredType, Integer maxLength,
                               boolean nullable, int ordinalPosition) {

    public static final String UNKNOWN_TYPE = "unknown";

    public ColumnDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be null or blank");
        }
        declaredType = declaredType == null || declaredType.isBlank() ? UNKNOWN_TYPE : declaredType.trim();
    }

    public static ColumnDescriptor of(String name, String declaredType, boolean nullable, int ordinalPosition) {
        return new ColumnDescriptor(name, declaredType, null, nullable, ordinalPosition);
    }

    /** Placeholder used when the catalog could not be read. */
    public static ColumnDescriptor placeholder(String name, int ordinalPosition) {
        return new ColumnDescriptor(name, UNKNOWN_TYPE, null, true, ordinalPosition);
    }

    /** Lower-cased name used for cross-dataset matching. */
    public String normalizedName() {
        return normalize(name);
    }

    public boolean hasName(String other) {
        return other != null && normalizedName().equals(normalize(other));
    }

    /** Type comparison ignores case and surrounding whitespace. */
    public boolean sameType(ColumnDescriptor other) {
        return declaredType.toLowerCase(Locale.ROOT).equals(other.declaredType.toLowerCase(Locale.ROOT));
    }

    public static String normalize(String columnName) {
        return columnName.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return name + " " + declaredType + (maxLength != null ? "(" + maxLength + ")" : "")
                + (nullable ? "" : " NOT NULL");
    }
}
