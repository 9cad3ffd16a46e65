package com.di.tablerecon.controller;

import com.di.tablerecon.config.ReconciliationProperties;
import com.di.tablerecon.dataset.JdbcQueryExecutor;
import com.di.tablerecon.drift.SchemaDriftDetector;
import com.di.tablerecon.engine.ReconciliationEngine;
import com.di.tablerecon.exception.GlobalExceptionHandler;
import com.di.tablerecon.profile.AggregateProfiler;
import com.di.tablerecon.rows.KeyUniquenessChecker;
import com.di.tablerecon.rows.RowReconciliationEngine;
import com.di.tablerecon.schema.InformationSchemaIntrospector;
import com.di.tablerecon.support.DuckDbTestWarehouse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST layer over an in-memory warehouse, including the error mapping.
 */
@DisplayName("Controller Integration Tests")
class ControllerIntegrationTest {

    private DuckDbTestWarehouse warehouse;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        warehouse = new DuckDbTestWarehouse();
        warehouse.execute(
                "CREATE TABLE src (id INTEGER NOT NULL, region VARCHAR, amount INTEGER, created DATE)",
                "CREATE TABLE tgt (id INTEGER NOT NULL, region VARCHAR, amount INTEGER, created DATE)",
                "INSERT INTO src VALUES (1, 'eu', 10, DATE '2024-01-03'), (2, 'us', 20, DATE '2024-02-11'), "
                        + "(3, 'eu', 30, DATE '2024-02-12')",
                "INSERT INTO tgt VALUES (1, 'eu', 10, DATE '2024-01-03'), (2, 'us', 25, DATE '2024-02-11'), "
                        + "(2, 'us', 25, DATE '2024-02-11')");

        ReconciliationProperties properties = new ReconciliationProperties();
        properties.setDefaultSchema(DuckDbTestWarehouse.DEFAULT_SCHEMA);
        InformationSchemaIntrospector introspector = warehouse.introspector();
        JdbcQueryExecutor executor = warehouse.queryExecutor();
        ReconciliationEngine engine = ReconciliationEngine.create(introspector, executor, executor, properties);

        mockMvc = MockMvcBuilders
                .standaloneSetup(
                        new ReconciliationController(engine, new RowReconciliationEngine(executor, introspector),
                                new KeyUniquenessChecker(executor), introspector, properties),
                        new DatasetController(introspector, new SchemaDriftDetector(),
                                new AggregateProfiler(executor), properties))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        warehouse.close();
    }

    // ============================================================================
    // Reconciliation Endpoints
    // ============================================================================

    @Test
    @DisplayName("Should run a reconciliation and return the report with log lines")
    void testReconcile() throws Exception {
        mockMvc.perform(post("/api/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sources\": [\"src\"], \"target\": \"tgt\", \"keyColumns\": [\"id\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.status").value("WARNING"))
                .andExpect(jsonPath("$.report.rowDiffs[0].missingCount").value(1))
                .andExpect(jsonPath("$.report.keySet.columns[0]").value("id"))
                .andExpect(jsonPath("$.logLines").isArray());
    }

    @Test
    @DisplayName("Should reject a reconciliation without target")
    void testReconcile_InvalidBody() throws Exception {
        mockMvc.perform(post("/api/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sources\": [\"src\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.fieldErrors.target").exists());
    }

    @Test
    @DisplayName("Should answer 422 when the target cannot be resolved")
    void testReconcile_TargetUnavailable() throws Exception {
        mockMvc.perform(post("/api/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sources\": [\"src\"], \"target\": \"gone\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.failureKind").value("TARGET_UNAVAILABLE"))
                .andExpect(jsonPath("$.details.dataset").value("main.gone"));
    }

    @Test
    @DisplayName("Should reject a dangerous dataset name")
    void testReconcile_DangerousName() throws Exception {
        mockMvc.perform(post("/api/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sources\": [\"src; DROP TABLE tgt\"], \"target\": \"tgt\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should compare two versions of a dataset")
    void testCompareVersions() throws Exception {
        mockMvc.perform(post("/api/version-comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"oldVersion\": \"src\", \"newVersion\": \"tgt\", \"keyColumns\": [\"id\"], "
                                + "\"columns\": [\"amount\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.oldRecordCount").value(3))
                .andExpect(jsonPath("$.recordsInOldNotInNew").value(1))
                .andExpect(jsonPath("$.columnValueComparisons[0].columnName").value("amount"));
    }

    @Test
    @DisplayName("Should find duplicated keys")
    void testDuplicateKeys() throws Exception {
        mockMvc.perform(post("/api/duplicate-keys")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset\": \"tgt\", \"keyColumns\": [\"id\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicateKeyCount").value(1))
                .andExpect(jsonPath("$.samples[0].occurrences").value(2));
    }

    @Test
    @DisplayName("Should answer 422 for a key column the dataset lacks")
    void testDuplicateKeys_KeyColumnNotFound() throws Exception {
        mockMvc.perform(post("/api/duplicate-keys")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset\": \"tgt\", \"keyColumns\": [\"order_key\"]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.failureKind").value("KEY_COLUMN_NOT_FOUND"))
                .andExpect(jsonPath("$.details.column").value("order_key"));
    }

    // ============================================================================
    // Dataset Endpoints
    // ============================================================================

    @Test
    @DisplayName("Should describe a dataset")
    void testDescribe() throws Exception {
        mockMvc.perform(get("/api/datasets/src/schema"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataset.schema").value("main"))
                .andExpect(jsonPath("$.columns[0].name").value("id"))
                .andExpect(jsonPath("$.columns[0].nullable").value(false))
                .andExpect(jsonPath("$.authoritative").value(true));
    }

    @Test
    @DisplayName("Should answer 502 when the catalog has no such dataset")
    void testDescribe_Missing() throws Exception {
        mockMvc.perform(get("/api/datasets/gone/schema"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.details.failureKind").value("METADATA_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Should diff two datasets")
    void testSchemaDrift() throws Exception {
        warehouse.execute("CREATE TABLE tgt_v2 (id BIGINT NOT NULL, region VARCHAR, created DATE, note VARCHAR)");

        mockMvc.perform(post("/api/schema-drift")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"before\": \"tgt\", \"after\": \"tgt_v2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added[0].name").value("note"))
                .andExpect(jsonPath("$.removed[0].name").value("amount"))
                .andExpect(jsonPath("$.changed[0].name").value("id"));
    }

    @Test
    @DisplayName("Should reject an incomplete drift request")
    void testSchemaDrift_Incomplete() throws Exception {
        mockMvc.perform(post("/api/schema-drift")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"before\": \"tgt\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.complete").exists());
    }

    @Test
    @DisplayName("Should profile requested columns")
    void testProfile() throws Exception {
        mockMvc.perform(post("/api/profiles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset\": \"src\", \"columns\": [\"amount\", \"region:string\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRows").value(3))
                .andExpect(jsonPath("$.profiles[0].mean").value(20.0))
                .andExpect(jsonPath("$.profiles[1].distinctCount").value(2));
    }

    @Test
    @DisplayName("Should aggregate by group")
    void testAggregate() throws Exception {
        mockMvc.perform(post("/api/aggregations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset\": \"src\", \"groupColumn\": \"region\", \"measureColumn\": \"amount\", "
                                + "\"stats\": [\"SUM\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].groupValue").value("eu"))
                .andExpect(jsonPath("$[0].values.SUM").value(40));
    }

    @Test
    @DisplayName("Should answer 422 for an unknown group column")
    void testAggregate_UnknownColumn() throws Exception {
        mockMvc.perform(post("/api/aggregations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset\": \"src\", \"groupColumn\": \"country\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.failureKind").value("COLUMN_NOT_FOUND"));
    }

    @Test
    @DisplayName("Should bucket records by month")
    void testDateDistribution() throws Exception {
        mockMvc.perform(post("/api/date-distributions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset\": \"src\", \"dateColumn\": \"created\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.datePart").value("MONTH"))
                .andExpect(jsonPath("$.uniquePeriods").value(2))
                .andExpect(jsonPath("$.maxPeriod").value("2024-02"));
    }

    @Test
    @DisplayName("Should compare column distributions")
    void testDistributionShift() throws Exception {
        mockMvc.perform(post("/api/distribution-shifts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"before\": \"src\", \"after\": \"tgt\", \"columns\": [\"region\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].beforeDistinctCount").value(2))
                .andExpect(jsonPath("$[0].afterDistinctCount").value(2));
    }
}
