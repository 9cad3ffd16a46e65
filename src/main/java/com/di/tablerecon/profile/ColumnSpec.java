package com.di.tablerecon.profile;

import com.di.tablerecon.util.InputValidator;

/**
 * A column to profile, optionally with a caller-chosen category.
 *
 * @param name     column name
 * @param category category override, or null to derive it from the declared type
 */
public record ColumnSpec(String name, ColumnCategory category) {

    public ColumnSpec {
        name = InputValidator.validateColumnName(name);
    }

    public static ColumnSpec of(String name) {
        return new ColumnSpec(name, null);
    }

    /**
     * Parses {@code "column"} or {@code "column:type"}, e.g. {@code "amount:numeric"}.
     */
    public static ColumnSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Column spec cannot be null or blank");
        }
        int colon = spec.indexOf(':');
        if (colon < 0) {
            return of(spec);
        }
        return new ColumnSpec(spec.substring(0, colon), ColumnCategory.fromLabel(spec.substring(colon + 1)));
    }
}
