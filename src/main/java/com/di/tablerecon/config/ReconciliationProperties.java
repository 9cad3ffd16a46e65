package com.di.tablerecon.config;

import com.di.tablerecon.key.KeyFallbackStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine tuning, bound from {@code tablerecon.reconciliation.*}.
 *
 * <pre>
 * tablerecon:
 *   reconciliation:
 *     default-schema: public
 *     max-parallelism: 4
 *     query-timeout-seconds: 300
 *     step-timeout-seconds: 900
 *     sample-limit: 5
 *     duplicate-sample-limit: 10
 *     key-patterns: id,key,pk,primary_key
 *     key-fallback: FIRST_COMMON_COLUMN
 *     window:
 *       lookback-days: 60
 *       forward-days: 30
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "tablerecon.reconciliation")
public class ReconciliationProperties {

    /** Schema used for dataset names given without one. Null = let the connection decide. */
    private String defaultSchema;

    /** Worker threads per run for independent per-dataset steps. */
    private int maxParallelism = 4;

    /** JDBC statement timeout. 0 = driver default (no timeout). */
    private int queryTimeoutSeconds = 0;

    /** Upper bound for one concurrent step (introspection, one comparison, one profile). 0 = unbounded. */
    private long stepTimeoutSeconds = 0;

    /** Sample rows kept per missing-row / missing-key finding. */
    private int sampleLimit = 5;

    /** Sample keys kept per duplicate-key finding. */
    private int duplicateSampleLimit = 10;

    /** Substrings that mark a column as a key candidate, in priority order. */
    private List<String> keyPatterns = new ArrayList<>(List.of("id", "key", "pk", "primary_key"));

    /** Behaviour when no common column matches {@link #keyPatterns}. */
    private KeyFallbackStrategy keyFallback = KeyFallbackStrategy.FIRST_COMMON_COLUMN;

    private Window window = new Window();

    @Data
    public static class Window {
        /** Days before "now" covered by a default profiling window. */
        private int lookbackDays = 60;
        /** Days after "now" covered by a default profiling window. */
        private int forwardDays = 30;
    }
}
