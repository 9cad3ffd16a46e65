package com.di.tablerecon.dataset;

import com.di.tablerecon.util.InputValidator;

/**
 * Read-only reference to a tabular dataset in the warehouse.
 * <p>
 * {@code schema} may be null, in which case the dataset resolves against the configured
 * default schema (see {@link #resolve(String)}).
 *
 * @param schema schema (location) of the dataset, or null for the default schema
 * @param name   table or view name
 */
public record DatasetHandle(String schema, String name) {

    public DatasetHandle {
        InputValidator.validateIdentifier(name, "dataset name");
        name = name.trim();
        if (schema != null) {
            if (schema.isBlank()) {
                schema = null;
            } else {
                InputValidator.validateIdentifier(schema, "schema name");
                schema = schema.trim();
            }
        }
    }

    /**
     * Parses {@code "schema.table"} or {@code "table"}.
     */
    public static DatasetHandle parse(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.isBlank()) {
            throw new IllegalArgumentException("Dataset name cannot be null or blank");
        }
        String[] parts = qualifiedName.trim().split("\\.");
        if (parts.length == 1) {
            return new DatasetHandle(null, parts[0]);
        }
        if (parts.length == 2) {
            return new DatasetHandle(parts[0], parts[1]);
        }
        throw new IllegalArgumentException(
                String.format("Invalid dataset name '%s'. Expected format: table or schema.table", qualifiedName));
    }

    public static DatasetHandle of(String schema, String name) {
        return new DatasetHandle(schema, name);
    }

    /**
     * Returns a handle with the schema filled in, when this handle has none.
     */
    public DatasetHandle resolve(String defaultSchema) {
        if (schema != null || defaultSchema == null || defaultSchema.isBlank()) {
            return this;
        }
        return new DatasetHandle(defaultSchema, name);
    }

    public String qualifiedName() {
        return schema == null ? name : schema + "." + name;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
