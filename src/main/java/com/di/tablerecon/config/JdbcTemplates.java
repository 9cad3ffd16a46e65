package com.di.tablerecon.config;

import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Creates the {@link JdbcTemplate} used for all warehouse reads.
 */
public final class JdbcTemplates {

    private JdbcTemplates() {}

    public static JdbcTemplate create(DataSource dataSource, ReconciliationProperties properties) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        if (properties.getQueryTimeoutSeconds() > 0) {
            template.setQueryTimeout(properties.getQueryTimeoutSeconds());
        }
        return template;
    }
}
