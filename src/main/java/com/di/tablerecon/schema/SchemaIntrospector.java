package com.di.tablerecon.schema;

import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.exception.MetadataUnavailableException;

/**
 * Schema introspection capability of the warehouse catalog.
 */
public interface SchemaIntrospector {

    /**
     * Describes a dataset's columns in ordinal order.
     *
     * @throws MetadataUnavailableException when the catalog cannot be queried or shows no columns
     */
    SchemaSnapshot describe(DatasetHandle dataset);
}
