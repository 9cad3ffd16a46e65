package com.di.tablerecon.profile;

import java.util.Locale;
import java.util.Set;

/**
 * Declared-type category deciding which statistics a column gets.
 */
public enum ColumnCategory {
    NUMERIC,
    STRING,
    TEMPORAL,
    UNKNOWN;

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "int", "integer", "int2", "int4", "int8", "smallint", "bigint", "tinyint", "hugeint",
            "utinyint", "usmallint", "uinteger", "ubigint", "uhugeint",
            "numeric", "decimal", "number", "real", "float", "float4", "float8", "double",
            "double precision", "money");

    private static final Set<String> STRING_TYPES = Set.of(
            "varchar", "character varying", "char", "character", "bpchar", "nchar", "nvarchar",
            "text", "string");

    private static final Set<String> TEMPORAL_TYPES = Set.of(
            "date", "datetime", "timestamp", "timestamptz", "timestamp with time zone",
            "timestamp without time zone", "timestamp_s", "timestamp_ms", "timestamp_ns",
            "time", "timetz", "time with time zone", "time without time zone");

    /**
     * Maps a catalog type such as {@code DECIMAL(18,2)} or {@code character varying} to a category.
     */
    public static ColumnCategory fromDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            return UNKNOWN;
        }
        String base = declaredType.trim().toLowerCase(Locale.ROOT);
        int paren = base.indexOf('(');
        if (paren > 0) {
            base = base.substring(0, paren).trim();
        }
        if (NUMERIC_TYPES.contains(base)) {
            return NUMERIC;
        }
        if (STRING_TYPES.contains(base)) {
            return STRING;
        }
        if (TEMPORAL_TYPES.contains(base)) {
            return TEMPORAL;
        }
        return UNKNOWN;
    }

    /**
     * Maps a caller label ({@code numeric}, {@code string}, {@code date} ...) to a category.
     * Labels not recognised as a category name fall back to {@link #fromDeclaredType(String)}.
     */
    public static ColumnCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String lower = label.trim().toLowerCase(Locale.ROOT);
        for (ColumnCategory category : values()) {
            if (category.name().toLowerCase(Locale.ROOT).equals(lower)) {
                return category;
            }
        }
        return fromDeclaredType(lower);
    }
}
