package com.di.tablerecon.schema;

import com.di.tablerecon.dataset.DatasetHandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered column list of one dataset at one point in time.
 * <p>
 * A non-authoritative snapshot was assembled from a caller-supplied column list because the
 * catalog could not be read; its types and nullability are placeholders.
 */
public record SchemaSnapshot(DatasetHandle dataset, List<ColumnDescriptor> columns,
                             boolean authoritative, Instant capturedAt) {

    public SchemaSnapshot {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset cannot be null");
        }
        List<ColumnDescriptor> ordered = new ArrayList<>(columns == null ? List.of() : columns);
        ordered.sort(Comparator.comparingInt(ColumnDescriptor::ordinalPosition));
        columns = List.copyOf(ordered);
        capturedAt = capturedAt == null ? Instant.now() : capturedAt;
    }

    public static SchemaSnapshot of(DatasetHandle dataset, List<ColumnDescriptor> columns) {
        return new SchemaSnapshot(dataset, columns, true, Instant.now());
    }

    /**
     * Builds a placeholder snapshot from bare column names (catalog unavailable).
     */
    public static SchemaSnapshot fallback(DatasetHandle dataset, Collection<String> columnNames) {
        List<ColumnDescriptor> columns = new ArrayList<>();
        int position = 1;
        for (String name : columnNames) {
            if (columns.stream().noneMatch(c -> c.hasName(name))) {
                columns.add(ColumnDescriptor.placeholder(name.trim(), position++));
            }
        }
        return new SchemaSnapshot(dataset, columns, false, Instant.now());
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDescriptor::name).toList();
    }

    /** Case-insensitive lookup. */
    public Optional<ColumnDescriptor> find(String columnName) {
        return columns.stream().filter(c -> c.hasName(columnName)).findFirst();
    }

    public boolean contains(String columnName) {
        return find(columnName).isPresent();
    }

    public int columnCount() {
        return columns.size();
    }
}
