package com.di.tablerecon.config;

import com.di.tablerecon.util.InputValidator;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Builds the read-only warehouse pool from {@link WarehouseDataSourceProperties}.
 * Spring Boot's DataSource auto-configuration is excluded in the application class.
 */
@Slf4j
@Configuration
public class WarehouseDataSourceConfiguration {

    @Bean(destroyMethod = "close")
    public HikariDataSource warehouseDataSource(WarehouseDataSourceProperties properties) {
        DbConfigSnapshot snapshot = properties.toDbConfigSnapshot();
        if (snapshot.jdbcUrl() == null || snapshot.jdbcUrl().isBlank()) {
            throw new IllegalStateException("tablerecon.datasource.jdbc-url is required");
        }

        int effectiveMinIdle = Math.min(snapshot.minimumIdle(), snapshot.maximumPoolSize());

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
        hikariConfig.setUsername(snapshot.username());
        hikariConfig.setPassword(snapshot.password());
        hikariConfig.setDriverClassName(snapshot.driverClassName());
        hikariConfig.setMaximumPoolSize(snapshot.maximumPoolSize());
        hikariConfig.setMinimumIdle(effectiveMinIdle);
        hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
        hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
        hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
        hikariConfig.setPoolName("tablerecon-warehouse");

        // Reconciliation never writes
        hikariConfig.setReadOnly(true);
        hikariConfig.setAutoCommit(true);
        // Start even if the warehouse is down; each request then reports its own failures
        hikariConfig.setInitializationFailTimeout(-1);

        if (snapshot.jdbcUrl().contains("postgresql") || snapshot.jdbcUrl().contains("redshift")) {
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        }

        log.info("[POOL] Creating warehouse pool | url={} | user={} | maxPoolSize={} | minIdle={}",
                InputValidator.sanitizeForLogging(snapshot.jdbcUrl()), snapshot.username(),
                snapshot.maximumPoolSize(), effectiveMinIdle);

        return new HikariDataSource(hikariConfig);
    }

    @Bean
    public JdbcTemplate warehouseJdbcTemplate(DataSource warehouseDataSource, ReconciliationProperties properties) {
        return JdbcTemplates.create(warehouseDataSource, properties);
    }
}
