package com.di.tablerecon.key;

import com.di.tablerecon.exception.EmptyKeySetException;
import com.di.tablerecon.exception.KeyColumnNotFoundException;
import com.di.tablerecon.schema.ColumnDescriptor;
import com.di.tablerecon.schema.SchemaSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered, non-empty list of columns that jointly identify a row across datasets.
 *
 * @param columns key column names, in key order
 * @param origin  whether the key was supplied by the caller or inferred
 */
public record KeySet(List<String> columns, Origin origin) {

    public enum Origin { EXPLICIT, INFERRED }

    public KeySet {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Key set cannot be empty");
        }
        List<String> distinct = new ArrayList<>();
        for (String column : columns) {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("Key column name cannot be null or blank");
            }
            String trimmed = column.trim();
            if (distinct.stream().noneMatch(c -> c.equalsIgnoreCase(trimmed))) {
                distinct.add(trimmed);
            }
        }
        columns = List.copyOf(distinct);
        origin = origin == null ? Origin.EXPLICIT : origin;
    }

    /**
     * Caller-supplied key.
     *
     * @param context dataset or request the key was supplied for, used in the error
     * @throws EmptyKeySetException when {@code columns} is null or empty
     */
    public static KeySet explicit(List<String> columns, String context) {
        if (columns == null || columns.stream().allMatch(c -> c == null || c.isBlank())) {
            throw new EmptyKeySetException(context);
        }
        return new KeySet(columns.stream().filter(c -> c != null && !c.isBlank()).toList(), Origin.EXPLICIT);
    }

    public static KeySet inferred(List<String> columns) {
        return new KeySet(columns, Origin.INFERRED);
    }

    public boolean isExplicit() {
        return origin == Origin.EXPLICIT;
    }

    public boolean contains(String column) {
        return column != null && columns.stream().anyMatch(c -> c.equalsIgnoreCase(column.trim()));
    }

    /**
     * Maps the key columns onto the spelling used by one dataset.
     * <p>
     * A non-authoritative snapshot cannot prove a column absent, so its unknown key columns
     * are passed through unchanged and the query itself decides.
     *
     * @throws KeyColumnNotFoundException when an authoritative snapshot lacks a key column
     */
    public List<String> resolveAgainst(SchemaSnapshot snapshot) {
        List<String> resolved = new ArrayList<>(columns.size());
        for (String column : columns) {
            Optional<ColumnDescriptor> match = snapshot.find(column);
            if (match.isPresent()) {
                resolved.add(match.get().name());
            } else if (snapshot.authoritative()) {
                throw new KeyColumnNotFoundException(snapshot.dataset().qualifiedName(), column, columns);
            } else {
                resolved.add(column);
            }
        }
        return List.copyOf(resolved);
    }

    @Override
    public String toString() {
        return columns + " (" + origin.name().toLowerCase(Locale.ROOT) + ")";
    }
}
