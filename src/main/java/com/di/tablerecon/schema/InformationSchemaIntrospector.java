package com.di.tablerecon.schema;

import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.exception.MetadataUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;

/**
 * Reads column metadata from {@code information_schema.columns}.
 * <p>
 * Table and schema are matched case-insensitively. A handle without schema is resolved against
 * the configured default schema, or the connection's {@code current_schema()} when none is set.
 */
@Slf4j
public class InformationSchemaIntrospector implements SchemaIntrospector {

    private static final String COLUMNS_SQL =
            "SELECT column_name, data_type, character_maximum_length, is_nullable, ordinal_position " +
            "FROM information_schema.columns " +
            "WHERE lower(table_name) = lower(?) AND %s " +
            "ORDER BY ordinal_position";

    private static final String EXPLICIT_SCHEMA_PREDICATE = "lower(table_schema) = lower(?)";
    private static final String CURRENT_SCHEMA_PREDICATE = "lower(table_schema) = lower(current_schema())";

    private static final RowMapper<ColumnDescriptor> COLUMN_MAPPER = (rs, rowNum) -> {
        Object maxLength = rs.getObject("character_maximum_length");
        Object ordinal = rs.getObject("ordinal_position");
        return new ColumnDescriptor(
                rs.getString("column_name"),
                rs.getString("data_type"),
                maxLength instanceof Number n ? n.intValue() : null,
                !"NO".equalsIgnoreCase(rs.getString("is_nullable")),
                ordinal instanceof Number n ? n.intValue() : rowNum + 1);
    };

    private final JdbcTemplate jdbcTemplate;
    private final String defaultSchema;

    public InformationSchemaIntrospector(JdbcTemplate jdbcTemplate, String defaultSchema) {
        this.jdbcTemplate = jdbcTemplate;
        this.defaultSchema = defaultSchema;
    }

    @Override
    public SchemaSnapshot describe(DatasetHandle dataset) {
        DatasetHandle resolved = dataset.resolve(defaultSchema);
        long start = System.currentTimeMillis();

        List<ColumnDescriptor> columns;
        try {
            if (resolved.schema() == null) {
                columns = jdbcTemplate.query(String.format(COLUMNS_SQL, CURRENT_SCHEMA_PREDICATE),
                        COLUMN_MAPPER, resolved.name());
            } else {
                columns = jdbcTemplate.query(String.format(COLUMNS_SQL, EXPLICIT_SCHEMA_PREDICATE),
                        COLUMN_MAPPER, resolved.name(), resolved.schema());
            }
        } catch (DataAccessException e) {
            log.warn("[INTROSPECT] Catalog query failed for {}: {}", resolved, e.getMessage());
            throw new MetadataUnavailableException(resolved.qualifiedName(), e.getMessage(), e);
        }

        if (columns.isEmpty()) {
            log.warn("[INTROSPECT] No visible columns for {}", resolved);
            throw new MetadataUnavailableException(resolved.qualifiedName(),
                    "catalog returned no columns (dataset missing or not visible)");
        }

        log.debug("[INTROSPECT] {} -> {} columns in {} ms", resolved, columns.size(),
                System.currentTimeMillis() - start);
        return SchemaSnapshot.of(resolved, columns);
    }
}
