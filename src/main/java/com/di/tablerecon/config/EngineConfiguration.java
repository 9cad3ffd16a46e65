package com.di.tablerecon.config;

import com.di.tablerecon.dataset.JdbcQueryExecutor;
import com.di.tablerecon.drift.SchemaDriftDetector;
import com.di.tablerecon.drift.SourceColumnMerger;
import com.di.tablerecon.engine.ReconciliationEngine;
import com.di.tablerecon.key.KeyInferenceEngine;
import com.di.tablerecon.profile.AggregateProfiler;
import com.di.tablerecon.report.ReportLogFormatter;
import com.di.tablerecon.rows.KeyUniquenessChecker;
import com.di.tablerecon.rows.RowReconciliationEngine;
import com.di.tablerecon.schema.InformationSchemaIntrospector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Engine components over the warehouse {@link JdbcTemplate}. The components themselves are
 * plain classes so they can be built without a Spring context.
 */
@Slf4j
@Configuration
public class EngineConfiguration {

    @Bean
    public InformationSchemaIntrospector schemaIntrospector(JdbcTemplate warehouseJdbcTemplate,
                                                            ReconciliationProperties properties) {
        return new InformationSchemaIntrospector(warehouseJdbcTemplate, properties.getDefaultSchema());
    }

    @Bean
    public JdbcQueryExecutor queryExecutor(JdbcTemplate warehouseJdbcTemplate, ReconciliationProperties properties) {
        return new JdbcQueryExecutor(warehouseJdbcTemplate, properties.getDefaultSchema());
    }

    @Bean
    public KeyInferenceEngine keyInferenceEngine(ReconciliationProperties properties) {
        log.info("[KEYS] Key patterns={} | fallback={}", properties.getKeyPatterns(), properties.getKeyFallback());
        return new KeyInferenceEngine(properties.getKeyPatterns(), properties.getKeyFallback());
    }

    @Bean
    public RowReconciliationEngine rowReconciliationEngine(JdbcQueryExecutor queryExecutor,
                                                           InformationSchemaIntrospector schemaIntrospector,
                                                           ReconciliationProperties properties) {
        return new RowReconciliationEngine(queryExecutor, schemaIntrospector, properties.getSampleLimit());
    }

    @Bean
    public KeyUniquenessChecker keyUniquenessChecker(JdbcQueryExecutor queryExecutor,
                                                     ReconciliationProperties properties) {
        return new KeyUniquenessChecker(queryExecutor, properties.getDuplicateSampleLimit());
    }

    @Bean
    public SchemaDriftDetector schemaDriftDetector() {
        return new SchemaDriftDetector();
    }

    @Bean
    public SourceColumnMerger sourceColumnMerger() {
        return new SourceColumnMerger();
    }

    @Bean
    public AggregateProfiler aggregateProfiler(JdbcQueryExecutor queryExecutor) {
        return new AggregateProfiler(queryExecutor);
    }

    @Bean
    public ReportLogFormatter reportLogFormatter() {
        return new ReportLogFormatter();
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(InformationSchemaIntrospector schemaIntrospector,
                                                     JdbcQueryExecutor queryExecutor,
                                                     KeyInferenceEngine keyInferenceEngine,
                                                     RowReconciliationEngine rowReconciliationEngine,
                                                     KeyUniquenessChecker keyUniquenessChecker,
                                                     SchemaDriftDetector schemaDriftDetector,
                                                     SourceColumnMerger sourceColumnMerger,
                                                     AggregateProfiler aggregateProfiler,
                                                     ReportLogFormatter reportLogFormatter,
                                                     ReconciliationProperties properties) {
        return new ReconciliationEngine(schemaIntrospector, queryExecutor, keyInferenceEngine,
                rowReconciliationEngine, keyUniquenessChecker, schemaDriftDetector, sourceColumnMerger,
                aggregateProfiler, reportLogFormatter, properties);
    }
}
