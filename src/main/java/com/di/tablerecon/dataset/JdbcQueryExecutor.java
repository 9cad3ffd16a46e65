package com.di.tablerecon.dataset;

import com.di.tablerecon.exception.QueryExecutionException;
import com.di.tablerecon.util.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link QueryExecutor} and {@link RowCountProvider} over a read-only {@link JdbcTemplate}.
 * The statement timeout is configured on the template.
 */
@Slf4j
public class JdbcQueryExecutor implements QueryExecutor, RowCountProvider {

    private final JdbcTemplate jdbcTemplate;
    private final String defaultSchema;

    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate, String defaultSchema) {
        this.jdbcTemplate = jdbcTemplate;
        this.defaultSchema = defaultSchema;
    }

    @Override
    public long countRows(DatasetHandle dataset) {
        DatasetHandle resolved = dataset.resolve(defaultSchema);
        return queryForLong(resolved.qualifiedName(), "SELECT COUNT(*) FROM " + SqlIdentifiers.table(resolved));
    }

    @Override
    public long queryForLong(String context, String sql, Object... args) {
        Object value = execute(context, sql, () -> jdbcTemplate.queryForObject(sql, Object.class, args));
        return value instanceof Number n ? n.longValue() : 0L;
    }

    @Override
    public Map<String, Object> queryForRow(String context, String sql, Object... args) {
        return execute(context, sql, () -> jdbcTemplate.queryForMap(sql, args));
    }

    @Override
    public List<Map<String, Object>> queryForRows(String context, String sql, Object... args) {
        return execute(context, sql, () -> jdbcTemplate.queryForList(sql, args));
    }

    public String getDefaultSchema() {
        return defaultSchema;
    }

    private <T> T execute(String context, String sql, Supplier<T> query) {
        long start = System.currentTimeMillis();
        try {
            T result = query.get();
            log.debug("Query on {} completed in {} ms", context, System.currentTimeMillis() - start);
            return result;
        } catch (DataAccessException e) {
            boolean timedOut = isTimeout(e);
            log.warn("Query on {} {} after {} ms: {}", context, timedOut ? "timed out" : "failed",
                    System.currentTimeMillis() - start, e.getMostSpecificCause().getMessage());
            log.debug("Failed SQL: {}", sql);
            throw new QueryExecutionException(context, null, null,
                    String.format("Query on '%s' %s: %s", context, timedOut ? "timed out" : "failed",
                            e.getMostSpecificCause().getMessage()),
                    timedOut, e);
        }
    }

    private static boolean isTimeout(DataAccessException e) {
        return e instanceof QueryTimeoutException || e.getMostSpecificCause() instanceof SQLTimeoutException;
    }
}
