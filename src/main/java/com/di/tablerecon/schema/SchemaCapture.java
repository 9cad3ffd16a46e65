package com.di.tablerecon.schema;

import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.exception.MetadataUnavailableException;

import java.util.Collection;
import java.util.List;

/**
 * Result of describing a dataset with the fallback path applied.
 *
 * @param snapshot authoritative snapshot, or a fallback snapshot built from the caller's column list
 * @param failure  the introspection failure that forced the fallback, or null
 */
public record SchemaCapture(SchemaSnapshot snapshot, MetadataUnavailableException failure) {

    /**
     * Describes {@code dataset}; when the catalog is unavailable, builds a non-authoritative
     * snapshot from {@code fallbackColumns} instead of failing.
     */
    public static SchemaCapture capture(SchemaIntrospector introspector, DatasetHandle dataset,
                                        Collection<String> fallbackColumns) {
        try {
            return new SchemaCapture(introspector.describe(dataset), null);
        } catch (MetadataUnavailableException e) {
            Collection<String> columns = fallbackColumns == null ? List.of() : fallbackColumns;
            return new SchemaCapture(SchemaSnapshot.fallback(dataset, columns), e);
        }
    }

    public boolean fellBack() {
        return failure != null;
    }
}
