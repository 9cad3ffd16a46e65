package com.di.tablerecon.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection to the warehouse holding the datasets, bound from {@code tablerecon.datasource.*}.
 */
@Data
@ConfigurationProperties(prefix = "tablerecon.datasource")
public class WarehouseDataSourceProperties {

    private String jdbcUrl;
    private String username;
    private String password;
    private String driverClassName = "org.postgresql.Driver";

    private int maximumPoolSize = 8;
    private int minimumIdle = 1;
    private long idleTimeoutMs = 300_000L;
    private long connectionTimeoutMs = 30_000L;
    private long maxLifetimeMs = 1_800_000L;

    public DbConfigSnapshot toDbConfigSnapshot() {
        return new DbConfigSnapshot(jdbcUrl, username, password, driverClassName,
                maximumPoolSize, minimumIdle, idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs);
    }
}
