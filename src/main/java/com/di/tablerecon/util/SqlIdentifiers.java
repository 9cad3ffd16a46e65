package com.di.tablerecon.util;

import com.di.tablerecon.dataset.DatasetHandle;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders validated identifiers into ANSI double-quoted SQL.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {}

    public static String quote(String identifier) {
        String validated = InputValidator.validateIdentifier(identifier, "identifier");
        return "\"" + validated.replace("\"", "\"\"") + "\"";
    }

    /** {@code "schema"."table"}, or {@code "table"} when the handle has no schema. */
    public static String table(DatasetHandle dataset) {
        if (dataset.schema() == null) {
            return quote(dataset.name());
        }
        return quote(dataset.schema()) + "." + quote(dataset.name());
    }

    /** {@code alias."column"}. */
    public static String column(String alias, String column) {
        return alias + "." + quote(column);
    }

    /** Comma-separated {@code alias."c1", alias."c2"}. */
    public static String columnList(String alias, List<String> columns) {
        return columns.stream()
                .map(c -> column(alias, c))
                .collect(Collectors.joining(", "));
    }

    /**
     * Equality join predicate over paired columns: {@code l."a" = r."a" AND l."b" = r."b"}.
     * Ordinary equality: NULL never matches NULL.
     */
    public static String equiJoin(String leftAlias, List<String> leftColumns,
                                  String rightAlias, List<String> rightColumns) {
        if (leftColumns.size() != rightColumns.size()) {
            throw new IllegalArgumentException(String.format(
                    "Join column lists differ in size: %s vs %s", leftColumns, rightColumns));
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < leftColumns.size(); i++) {
            if (i > 0) {
                sb.append(" AND ");
            }
            sb.append(column(leftAlias, leftColumns.get(i)))
              .append(" = ")
              .append(column(rightAlias, rightColumns.get(i)));
        }
        return sb.toString();
    }
}
