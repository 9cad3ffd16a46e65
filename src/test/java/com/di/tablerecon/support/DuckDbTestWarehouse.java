package com.di.tablerecon.support;

import com.di.tablerecon.dataset.JdbcQueryExecutor;
import com.di.tablerecon.schema.InformationSchemaIntrospector;
import org.duckdb.DuckDBConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.AbstractDataSource;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * In-memory DuckDB warehouse for tests.
 * <p>
 * An in-memory DuckDB database lives as long as its root connection, so every connection
 * handed out is a {@code duplicate()} of one root connection and sees the same tables.
 */
public class DuckDbTestWarehouse extends AbstractDataSource implements AutoCloseable {

    public static final String DEFAULT_SCHEMA = "main";

    private final DuckDBConnection root;

    public DuckDbTestWarehouse() {
        try {
            this.root = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot open in-memory DuckDB", e);
        }
    }

    @Override
    public Connection getConnection() throws SQLException {
        return root.duplicate();
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return getConnection();
    }

    /** Runs DDL/DML statements in order. */
    public DuckDbTestWarehouse execute(String... statements) {
        JdbcTemplate jdbc = jdbcTemplate();
        for (String statement : statements) {
            jdbc.execute(statement);
        }
        return this;
    }

    public JdbcTemplate jdbcTemplate() {
        return new JdbcTemplate(this);
    }

    public JdbcQueryExecutor queryExecutor() {
        return new JdbcQueryExecutor(jdbcTemplate(), DEFAULT_SCHEMA);
    }

    public InformationSchemaIntrospector introspector() {
        return new InformationSchemaIntrospector(jdbcTemplate(), DEFAULT_SCHEMA);
    }

    @Override
    public void close() throws SQLException {
        root.close();
    }
}
