package com.di.tablerecon.profile;

import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.dataset.QueryExecutor;
import com.di.tablerecon.exception.ColumnNotFoundException;
import com.di.tablerecon.exception.FailureKind;
import com.di.tablerecon.exception.QueryExecutionException;
import com.di.tablerecon.report.ComparisonFailure;
import com.di.tablerecon.schema.ColumnDescriptor;
import com.di.tablerecon.schema.SchemaSnapshot;
import com.di.tablerecon.support.DuckDbTestWarehouse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AggregateProfiler Tests")
class AggregateProfilerTest {

    private DuckDbTestWarehouse warehouse;
    private AggregateProfiler profiler;

    @BeforeEach
    void setUp() {
        warehouse = new DuckDbTestWarehouse();
        profiler = new AggregateProfiler(warehouse.queryExecutor());
    }

    @AfterEach
    void tearDown() throws Exception {
        warehouse.close();
    }

    private SchemaSnapshot describe(String table) {
        return warehouse.introspector().describe(DatasetHandle.parse(table));
    }

    private ColumnProfile profileOf(ProfileResult result, String column) {
        return result.getProfiles().stream()
                .filter(p -> p.getColumnName().equals(column))
                .findFirst()
                .orElseThrow();
    }

    private void createEvents() {
        warehouse.execute(
                "CREATE TABLE events (id INTEGER, amount INTEGER, name VARCHAR, created DATE)",
                "INSERT INTO events VALUES "
                        + "(1, 10, 'a', DATE '2024-01-05'), "
                        + "(2, 20, 'bbb', DATE '2024-01-20'), "
                        + "(3, 30, 'cc', DATE '2024-02-01'), "
                        + "(4, NULL, NULL, DATE '2024-04-10'), "
                        + "(5, NULL, 'a', NULL)");
    }

    // ============================================================================
    // Column Profiles
    // ============================================================================

    @Test
    @DisplayName("Should profile numeric columns with min, max, mean and median")
    void testProfile_Numeric() {
        createEvents();
        ProfileResult result = profiler.profile(describe("events"), List.of(ColumnSpec.of("amount")));

        ColumnProfile amount = profileOf(result, "amount");
        assertEquals(ColumnCategory.NUMERIC, amount.getCategory());
        assertEquals(5, amount.getTotalRows());
        assertEquals(3, amount.getNonNullCount());
        assertEquals(2, amount.getNullCount());
        assertEquals(40.0, amount.getNullPercentage(), 1e-9);
        assertEquals(10L, amount.getMinValue());
        assertEquals(30L, amount.getMaxValue());
        assertEquals(20.0, amount.getMean(), 1e-9);
        assertEquals(20.0, amount.getMedian(), 1e-9);
        assertTrue(result.getFailures().isEmpty());
    }

    @Test
    @DisplayName("Should profile string columns with lengths and distinct count")
    void testProfile_String() {
        createEvents();
        ProfileResult result = profiler.profile(describe("events"), List.of(ColumnSpec.of("name")));

        ColumnProfile name = profileOf(result, "name");
        assertEquals(ColumnCategory.STRING, name.getCategory());
        assertEquals(4, name.getNonNullCount());
        assertEquals(1, name.getMinLength());
        assertEquals(3, name.getMaxLength());
        assertEquals(1.75, name.getAvgLength(), 1e-9);
        assertEquals(3L, name.getDistinctCount());
    }

    @Test
    @DisplayName("Should profile temporal columns with their span in days")
    void testProfile_Temporal() {
        createEvents();
        ProfileResult result = profiler.profile(describe("events"), List.of(ColumnSpec.of("created")));

        ColumnProfile created = profileOf(result, "created");
        assertEquals(ColumnCategory.TEMPORAL, created.getCategory());
        assertEquals(1, created.getNullCount());
        assertEquals(LocalDate.of(2024, 1, 5), TemporalValues.toLocalDate(created.getMinValue()));
        assertEquals(LocalDate.of(2024, 4, 10), TemporalValues.toLocalDate(created.getMaxValue()));
        assertEquals(96L, created.getSpanDays());
    }

    @Test
    @DisplayName("Should apply a caller-chosen category over the declared type")
    void testProfile_CategoryOverride() {
        createEvents();
        ProfileResult result = profiler.profile(describe("events"), List.of(ColumnSpec.parse("id:string")));

        ColumnProfile id = profileOf(result, "id");
        assertEquals(ColumnCategory.STRING, id.getCategory());
        assertEquals(5L, id.getDistinctCount());
        assertNull(id.getMean());
    }

    @Test
    @DisplayName("Should leave null percentage undefined for an empty dataset")
    void testProfile_EmptyDataset() {
        warehouse.execute("CREATE TABLE empty_table (amount INTEGER)");
        ProfileResult result = profiler.profileAll(describe("empty_table"), null);

        assertEquals(0, result.getTotalRows());
        ColumnProfile amount = profileOf(result, "amount");
        assertEquals(0, amount.getNullCount());
        assertNull(amount.getNullPercentage());
    }

    @Test
    @DisplayName("Should report an unknown column as a failure and profile the others")
    void testProfile_UnknownColumn() {
        createEvents();
        ProfileResult result = profiler.profile(describe("events"),
                List.of(ColumnSpec.of("amount"), ColumnSpec.of("missing_col")));

        assertEquals(1, result.getProfiles().size());
        assertEquals(1, result.getFailures().size());
        ComparisonFailure failure = result.getFailures().get(0);
        assertEquals(FailureKind.COLUMN_NOT_FOUND, failure.kind());
        assertEquals("missing_col", failure.column());
    }

    @Test
    @DisplayName("Should restrict profiling to the time window")
    void testProfile_Window() {
        createEvents();
        ProfileWindow january = new ProfileWindow("created",
                LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 2, 1, 0, 0));

        ProfileResult result = profiler.profile(describe("events"), List.of(ColumnSpec.of("amount")), january);

        assertEquals(2, result.getTotalRows());
        assertEquals(15.0, profileOf(result, "amount").getMean(), 1e-9);
        assertEquals(january, result.getWindow());
    }

    @Test
    @DisplayName("Should profile every column with profileAll")
    void testProfileAll() {
        createEvents();
        ProfileResult result = profiler.profileAll(describe("events"), null);

        assertEquals(List.of("id", "amount", "name", "created"),
                result.getProfiles().stream().map(ColumnProfile::getColumnName).toList());
    }

    // ============================================================================
    // Grouped Aggregation
    // ============================================================================

    @Test
    @DisplayName("Should aggregate by group ordered by the first statistic, nulls last")
    void testAggregateBy_OrderedByFirstStat() {
        warehouse.execute(
                "CREATE TABLE sales (region VARCHAR, amount INTEGER)",
                "INSERT INTO sales VALUES ('eu', 10), ('eu', 20), ('us', 100), ('apac', NULL), (NULL, 5)");

        List<GroupAggregate> groups = profiler.aggregateBy(describe("sales"), "region", "amount",
                List.of(AggregateStat.SUM, AggregateStat.COUNT), null);

        assertEquals(Arrays.asList("us", "eu", null, "apac"),
                groups.stream().map(GroupAggregate::getGroupValue).toList());
        GroupAggregate eu = groups.get(1);
        assertEquals(2, eu.getRowCount());
        assertEquals(30L, eu.getValues().get(AggregateStat.SUM));
        assertEquals(2L, eu.getValues().get(AggregateStat.COUNT));

        GroupAggregate apac = groups.get(3);
        assertEquals(1, apac.getNullCount());
        assertEquals(100.0, apac.getNullPercentage(), 1e-9);
        assertNull(apac.getValues().get(AggregateStat.SUM));
    }

    @Test
    @DisplayName("Should order plain row counts by count, then group value")
    void testAggregateBy_RowCountsOnly() {
        warehouse.execute(
                "CREATE TABLE sales (region VARCHAR)",
                "INSERT INTO sales VALUES ('us'), ('eu'), ('eu'), ('apac')");

        List<GroupAggregate> groups = profiler.aggregateBy(describe("sales"), "region", null, List.of(), null);

        assertEquals(List.of("eu", "apac", "us"),
                groups.stream().map(GroupAggregate::getGroupValue).toList());
        assertEquals(0.0, groups.get(0).getNullPercentage(), 1e-9);
    }

    @Test
    @DisplayName("Should reject statistics without a measure column")
    void testAggregateBy_StatsWithoutMeasure() {
        warehouse.execute("CREATE TABLE sales (region VARCHAR)");
        SchemaSnapshot sales = describe("sales");

        assertThrows(IllegalArgumentException.class,
                () -> profiler.aggregateBy(sales, "region", null, List.of(AggregateStat.AVG), null));
    }

    @Test
    @DisplayName("Should fail with ColumnNotFoundException for an unknown group column")
    void testAggregateBy_UnknownColumn() {
        warehouse.execute("CREATE TABLE sales (region VARCHAR)");
        SchemaSnapshot sales = describe("sales");

        ColumnNotFoundException ex = assertThrows(ColumnNotFoundException.class,
                () -> profiler.aggregateBy(sales, "country", null, null, null));
        assertEquals("country", ex.getColumn());
    }

    // ============================================================================
    // Date Distribution
    // ============================================================================

    @Test
    @DisplayName("Should count records per month, excluding NULL dates")
    void testDateDistribution_Month() {
        createEvents();
        DateDistribution distribution = profiler.dateDistribution(describe("events"), "created", DatePart.MONTH, null);

        assertEquals(List.of("2024-01", "2024-02", "2024-04"),
                distribution.getBuckets().stream().map(DateDistribution.Bucket::label).toList());
        assertEquals(List.of(2L, 1L, 1L),
                distribution.getBuckets().stream().map(DateDistribution.Bucket::recordCount).toList());
        assertEquals(3, distribution.getUniquePeriods());
        assertEquals(4, distribution.getTotalRecords());
        assertEquals(1, distribution.getMinPeriodCount());
        assertEquals(2, distribution.getMaxPeriodCount());
        assertEquals("2024-01", distribution.getMinPeriod());
        assertEquals("2024-04", distribution.getMaxPeriod());
        assertEquals(4.0 / 3, distribution.getAvgPeriodCount(), 1e-9);
    }

    @Test
    @DisplayName("Should bucket by quarter")
    void testDateDistribution_Quarter() {
        createEvents();
        DateDistribution distribution = profiler.dateDistribution(describe("events"), "created", DatePart.QUARTER, null);

        assertEquals(List.of("2024-Q1", "2024-Q2"),
                distribution.getBuckets().stream().map(DateDistribution.Bucket::label).toList());
        assertEquals(LocalDate.of(2024, 4, 1), distribution.getBuckets().get(1).periodStart());
    }

    @Test
    @DisplayName("Should return an empty distribution when no dates fall in the window")
    void testDateDistribution_EmptyWindow() {
        createEvents();
        ProfileWindow window = new ProfileWindow("created",
                LocalDateTime.of(2030, 1, 1, 0, 0), LocalDateTime.of(2030, 2, 1, 0, 0));

        DateDistribution distribution = profiler.dateDistribution(describe("events"), "created", DatePart.DAY, window);

        assertEquals(0, distribution.getUniquePeriods());
        assertNull(distribution.getAvgPeriodCount());
        assertNull(distribution.getMinPeriod());
    }

    @Test
    @DisplayName("Should fail with a query error when the column is not a date")
    void testDateDistribution_NotADate() {
        createEvents();
        SchemaSnapshot events = describe("events");

        assertThrows(QueryExecutionException.class,
                () -> profiler.dateDistribution(events, "name", DatePart.MONTH, null));
    }

    // ============================================================================
    // Distribution Shift
    // ============================================================================

    @Test
    @DisplayName("Should compare non-null, distinct and null rates of common columns")
    void testCompareDistributions() {
        warehouse.execute(
                "CREATE TABLE before_t (id INTEGER, status VARCHAR, legacy VARCHAR)",
                "CREATE TABLE after_t (id INTEGER, status VARCHAR)",
                "INSERT INTO before_t VALUES (1, 'a', 'x'), (2, 'b', 'y'), (3, NULL, 'z'), (4, 'a', NULL)",
                "INSERT INTO after_t VALUES (1, 'a'), (2, 'a'), (3, 'a'), (4, 'a')");

        List<ColumnShift> shifts = profiler.compareDistributions(describe("before_t"), describe("after_t"), null);

        assertEquals(List.of("id", "status"), shifts.stream().map(ColumnShift::getColumnName).toList());
        ColumnShift status = shifts.get(1);
        assertEquals(3, status.getBeforeNonNullCount());
        assertEquals(4, status.getAfterNonNullCount());
        assertEquals(2, status.getBeforeDistinctCount());
        assertEquals(1, status.getAfterDistinctCount());
        assertEquals(25.0, status.getBeforeNullPercentage(), 1e-9);
        assertEquals(0.0, status.getAfterNullPercentage(), 1e-9);
        assertFalse(status.failed());
    }

    @Test
    @DisplayName("Should record a failure for a column missing on one side")
    void testCompareDistributions_MissingColumn() {
        warehouse.execute(
                "CREATE TABLE before_t (id INTEGER, legacy VARCHAR)",
                "CREATE TABLE after_t (id INTEGER)");

        List<ColumnShift> shifts = profiler.compareDistributions(describe("before_t"), describe("after_t"),
                List.of("id", "legacy"));

        assertFalse(shifts.get(0).failed());
        assertTrue(shifts.get(1).failed());
    }

    // ============================================================================
    // Exact Values
    // ============================================================================

    @Test
    @DisplayName("Should keep BIGINT and DECIMAL extremes exact")
    void testProfile_ExactNumericExtremes() {
        warehouse.execute(
                "CREATE TABLE ledger (id BIGINT, balance DECIMAL(38,6))",
                "INSERT INTO ledger VALUES (9007199254740993, 12345678901234567890.123456), (1, 0.000001)");

        ProfileResult result = profiler.profile(describe("ledger"),
                List.of(ColumnSpec.of("id"), ColumnSpec.of("balance")));

        ColumnProfile id = profileOf(result, "id");
        assertEquals(9007199254740993L, id.getMaxValue());
        assertEquals(1L, id.getMinValue());

        ColumnProfile balance = profileOf(result, "balance");
        assertEquals(0, new BigDecimal("12345678901234567890.123456").compareTo((BigDecimal) balance.getMaxValue()));
        assertEquals(0, new BigDecimal("0.000001").compareTo((BigDecimal) balance.getMinValue()));
    }

    @Test
    @DisplayName("Should keep group sums beyond double precision exact")
    void testAggregateBy_ExactSum() {
        warehouse.execute(
                "CREATE TABLE transfers (region VARCHAR, amount BIGINT)",
                "INSERT INTO transfers VALUES ('eu', 9007199254740992), ('eu', 1)");

        List<GroupAggregate> groups = profiler.aggregateBy(describe("transfers"), "region", "amount",
                List.of(AggregateStat.SUM, AggregateStat.MAX), null);

        assertEquals(9007199254740993L, groups.get(0).getValues().get(AggregateStat.SUM));
        assertEquals(9007199254740992L, groups.get(0).getValues().get(AggregateStat.MAX));
    }

    @Test
    void testExactNumber_Conversions() {
        assertEquals(7L, AggregateProfiler.exactNumber(7));
        assertEquals(7L, AggregateProfiler.exactNumber(BigInteger.valueOf(7)));
        BigInteger huge = BigInteger.ONE.shiftLeft(70);
        assertSame(huge, AggregateProfiler.exactNumber(huge));
        assertEquals(1.5, AggregateProfiler.exactNumber(1.5f));
        BigDecimal decimal = new BigDecimal("9007199254740993.5");
        assertSame(decimal, AggregateProfiler.exactNumber(decimal));
    }

    // ============================================================================
    // Driver Value Types
    // ============================================================================

    /**
     * Answers profile queries the way PgJDBC does for a {@code time} column and fails on demand.
     */
    private static final class ShiftsQueryExecutor implements QueryExecutor {

        @Override
        public long queryForLong(String context, String sql, Object... args) {
            return 2;
        }

        @Override
        public Map<String, Object> queryForRow(String context, String sql, Object... args) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (sql.contains("\"start_time\"")) {
                row.put("non_null_count", 2L);
                row.put("min_value", Time.valueOf("08:00:00"));
                row.put("max_value", Time.valueOf("17:30:00"));
            } else if (sql.contains("\"badge\"")) {
                throw new IllegalStateException("unreadable value in column badge");
            } else {
                row.put("non_null_count", 2L);
                row.put("min_value", 1);
                row.put("max_value", 2);
                row.put("mean_value", 1.5);
                row.put("median_value", 1.5);
            }
            return row;
        }

        @Override
        public List<Map<String, Object>> queryForRows(String context, String sql, Object... args) {
            return List.of();
        }
    }

    private static SchemaSnapshot shifts() {
        return SchemaSnapshot.of(DatasetHandle.of("public", "shifts"), List.of(
                ColumnDescriptor.of("id", "integer", false, 1),
                ColumnDescriptor.of("start_time", "time", true, 2),
                ColumnDescriptor.of("badge", "integer", true, 3)));
    }

    @Test
    @DisplayName("Should profile time-of-day columns without a day span")
    void testProfile_TimeOfDay() {
        AggregateProfiler stubbed = new AggregateProfiler(new ShiftsQueryExecutor());

        ProfileResult result = stubbed.profile(shifts(), List.of(ColumnSpec.of("id"), ColumnSpec.of("start_time")));

        assertTrue(result.getFailures().isEmpty());
        ColumnProfile startTime = profileOf(result, "start_time");
        assertEquals(ColumnCategory.TEMPORAL, startTime.getCategory());
        assertEquals(LocalTime.of(8, 0), startTime.getMinValue());
        assertEquals(LocalTime.of(17, 30), startTime.getMaxValue());
        assertNull(startTime.getSpanDays());
        assertEquals(1L, profileOf(result, "id").getMinValue());
    }

    @Test
    @DisplayName("Should keep an unexpected column error scoped to that column")
    void testProfile_UnexpectedErrorScopedToColumn() {
        AggregateProfiler stubbed = new AggregateProfiler(new ShiftsQueryExecutor());

        ProfileResult result = stubbed.profile(shifts(),
                List.of(ColumnSpec.of("id"), ColumnSpec.of("badge"), ColumnSpec.of("start_time")));

        assertEquals(List.of("id", "start_time"),
                result.getProfiles().stream().map(ColumnProfile::getColumnName).toList());
        assertEquals(1, result.getFailures().size());
        ComparisonFailure failure = result.getFailures().get(0);
        assertEquals(FailureKind.QUERY_EXECUTION_FAILURE, failure.kind());
        assertEquals("badge", failure.column());
        assertEquals("public.shifts", failure.dataset());
        assertTrue(failure.message().contains("unreadable value"));
    }
}
