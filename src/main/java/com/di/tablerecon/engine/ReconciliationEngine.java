package com.di.tablerecon.engine;

import com.di.tablerecon.config.ReconciliationProperties;
import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.dataset.QueryExecutor;
import com.di.tablerecon.dataset.RowCountProvider;
import com.di.tablerecon.drift.MergedColumns;
import com.di.tablerecon.drift.SchemaDriftDetector;
import com.di.tablerecon.drift.SourceColumnMerger;
import com.di.tablerecon.exception.MetadataUnavailableException;
import com.di.tablerecon.exception.QueryExecutionException;
import com.di.tablerecon.exception.ReconciliationException;
import com.di.tablerecon.exception.TargetUnavailableException;
import com.di.tablerecon.key.KeyInferenceEngine;
import com.di.tablerecon.key.KeySet;
import com.di.tablerecon.profile.AggregateProfiler;
import com.di.tablerecon.profile.ProfileResult;
import com.di.tablerecon.report.ComparisonFailure;
import com.di.tablerecon.report.DatasetSummary;
import com.di.tablerecon.report.ReconciliationReport;
import com.di.tablerecon.report.ReconciliationStep;
import com.di.tablerecon.report.ReportBuilder;
import com.di.tablerecon.report.ReportLogFormatter;
import com.di.tablerecon.rows.DuplicateKeyResult;
import com.di.tablerecon.rows.KeyUniquenessChecker;
import com.di.tablerecon.rows.RowDiffResult;
import com.di.tablerecon.rows.RowReconciliationEngine;
import com.di.tablerecon.rows.UnionCoverageResult;
import com.di.tablerecon.schema.SchemaCapture;
import com.di.tablerecon.schema.SchemaIntrospector;
import com.di.tablerecon.schema.SchemaSnapshot;
import com.di.tablerecon.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one {@link ReconciliationRequest} end to end.
 *
 * <p>Phases:
 * <ol>
 *   <li>Schema capture and row count of every dataset, concurrently. A target whose row count
 *       cannot be queried aborts the request with {@link TargetUnavailableException}.</li>
 *   <li>Key resolution (explicit or inferred) once all schemas are known.</li>
 *   <li>Row, union, uniqueness and profiling steps, concurrently; schema drift in between.</li>
 *   <li>Partial results are merged once by {@link ReportBuilder}; log lines are derived afterwards.</li>
 * </ol>
 * Every other failure is scoped to its step and reported in the report.
 */
@Slf4j
public class ReconciliationEngine {

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final SchemaIntrospector introspector;
    private final RowCountProvider rowCountProvider;
    private final KeyInferenceEngine keyInferenceEngine;
    private final RowReconciliationEngine rowReconciliationEngine;
    private final KeyUniquenessChecker keyUniquenessChecker;
    private final SchemaDriftDetector schemaDriftDetector;
    private final SourceColumnMerger sourceColumnMerger;
    private final AggregateProfiler aggregateProfiler;
    private final ReportLogFormatter reportLogFormatter;
    private final ReconciliationProperties properties;

    public ReconciliationEngine(SchemaIntrospector introspector,
                                RowCountProvider rowCountProvider,
                                KeyInferenceEngine keyInferenceEngine,
                                RowReconciliationEngine rowReconciliationEngine,
                                KeyUniquenessChecker keyUniquenessChecker,
                                SchemaDriftDetector schemaDriftDetector,
                                SourceColumnMerger sourceColumnMerger,
                                AggregateProfiler aggregateProfiler,
                                ReportLogFormatter reportLogFormatter,
                                ReconciliationProperties properties) {
        this.introspector = introspector;
        this.rowCountProvider = rowCountProvider;
        this.keyInferenceEngine = keyInferenceEngine;
        this.rowReconciliationEngine = rowReconciliationEngine;
        this.keyUniquenessChecker = keyUniquenessChecker;
        this.schemaDriftDetector = schemaDriftDetector;
        this.sourceColumnMerger = sourceColumnMerger;
        this.aggregateProfiler = aggregateProfiler;
        this.reportLogFormatter = reportLogFormatter;
        this.properties = properties;
    }

    /**
     * Wires the default components around the three warehouse capabilities.
     */
    public static ReconciliationEngine create(SchemaIntrospector introspector, QueryExecutor queryExecutor,
                                              RowCountProvider rowCountProvider, ReconciliationProperties properties) {
        return new ReconciliationEngine(introspector, rowCountProvider,
                new KeyInferenceEngine(properties.getKeyPatterns(), properties.getKeyFallback()),
                new RowReconciliationEngine(queryExecutor, introspector, properties.getSampleLimit()),
                new KeyUniquenessChecker(queryExecutor, properties.getDuplicateSampleLimit()),
                new SchemaDriftDetector(),
                new SourceColumnMerger(),
                new AggregateProfiler(queryExecutor),
                new ReportLogFormatter(),
                properties);
    }

    /**
     * @throws TargetUnavailableException when the target's row count cannot be queried
     * @throws IllegalArgumentException   when the request names no source or no target
     */
    public ReconciliationResult run(ReconciliationRequest request) {
        validate(request);
        String reconciliationId = UUID.randomUUID().toString().substring(0, 8);
        String previousId = MDC.get(MdcPropagation.RECONCILIATION_ID);
        MDC.put(MdcPropagation.RECONCILIATION_ID, reconciliationId);

        ExecutorService executor = newRunExecutor(request.getSources().size() + 1);
        try {
            ReconciliationReport report = execute(reconciliationId, request, executor);
            List<String> lines = reportLogFormatter.format(report);
            lines.forEach(log::info);
            return new ReconciliationResult(report, lines);
        } finally {
            executor.shutdownNow();
            if (previousId != null) {
                MDC.put(MdcPropagation.RECONCILIATION_ID, previousId);
            } else {
                MDC.remove(MdcPropagation.RECONCILIATION_ID);
            }
        }
    }

    private ReconciliationReport execute(String reconciliationId, ReconciliationRequest request,
                                         ExecutorService executor) {
        Instant startedAt = Instant.now();
        String defaultSchema = properties.getDefaultSchema();
        List<DatasetHandle> sources = request.getSources().stream().map(s -> s.resolve(defaultSchema)).toList();
        DatasetHandle target = request.getTarget().resolve(defaultSchema);
        List<String> fallbackColumns = !request.getFallbackColumns().isEmpty()
                ? request.getFallbackColumns()
                : request.getKeyColumns() == null ? List.of() : request.getKeyColumns();

        log.info("[REPORT] Starting reconciliation | scope={} | sources={} | target={}",
                request.getScope(), sources, target);

        ReportBuilder report = new ReportBuilder(reconciliationId, request.getScope(),
                sources.stream().map(DatasetHandle::qualifiedName).toList(), target.qualifiedName(), startedAt)
                .requiredColumns(request.getRequiredColumns());

        /* ---------------- Phase 1: schemas and row counts ---------------- */

        Future<Long> targetCount = executor.submit(() -> rowCountProvider.countRows(target));
        Future<SchemaCapture> targetSchema = executor.submit(() -> SchemaCapture.capture(introspector, target, fallbackColumns));
        Map<DatasetHandle, Future<Long>> sourceCounts = new LinkedHashMap<>();
        Map<DatasetHandle, Future<SchemaCapture>> sourceSchemas = new LinkedHashMap<>();
        for (DatasetHandle source : sources) {
            sourceCounts.put(source, executor.submit(() -> rowCountProvider.countRows(source)));
            sourceSchemas.put(source, executor.submit(() -> SchemaCapture.capture(introspector, source, fallbackColumns)));
        }

        StepOutcome<Long> targetRows = await(targetCount, ReconciliationStep.INTROSPECT, target.qualifiedName());
        if (!targetRows.succeeded()) {
            log.error("[REPORT] Target {} cannot be resolved: {}", target, targetRows.failure().message());
            throw new TargetUnavailableException(target.qualifiedName(), failureCause(targetCount));
        }

        SchemaSnapshot targetSnapshot = captured(targetSchema, target, fallbackColumns, report);
        List<SchemaSnapshot> sourceSnapshots = new ArrayList<>();
        Map<DatasetHandle, Long> sourceRowCounts = new LinkedHashMap<>();
        for (DatasetHandle source : sources) {
            sourceSnapshots.add(captured(sourceSchemas.get(source), source, fallbackColumns, report));
            StepOutcome<Long> rows = await(sourceCounts.get(source), ReconciliationStep.INTROSPECT, source.qualifiedName());
            if (rows.succeeded()) {
                sourceRowCounts.put(source, rows.value());
            } else {
                report.failure(rows.failure());
            }
        }
        sourceSnapshots.forEach(report::schema);
        report.schema(targetSnapshot);
        summarize(report, sources, sourceSnapshots, sourceRowCounts, targetSnapshot, targetRows.value());

        /* ---------------- Phase 2: keys ---------------- */

        KeySet keys = null;
        if (request.getScope().needsKeys() || request.isVerifyKeyUniqueness()) {
            keys = resolveKeys(request, sourceSnapshots, targetSnapshot, report);
            report.keySet(keys);
        }

        /* ---------------- Phase 3: comparisons ---------------- */

        List<Future<RowDiffResult>> rowDiffs = new ArrayList<>();
        Future<UnionCoverageResult> union = null;
        List<Future<DuplicateKeyResult>> duplicates = new ArrayList<>();
        List<Future<ProfileResult>> profiles = new ArrayList<>();
        List<String> submittedNames = new ArrayList<>();

        if (keys != null) {
            final KeySet k = keys;
            if (request.getScope().includesRows()) {
                for (SchemaSnapshot source : sourceSnapshots) {
                    rowDiffs.add(executor.submit(() -> rowReconciliationEngine.reconcile(source, targetSnapshot, k)));
                }
            }
            if (request.getScope().includesUnion()) {
                union = executor.submit(() -> rowReconciliationEngine.reconcileUnion(sourceSnapshots, targetSnapshot, k));
            }
            if (request.isVerifyKeyUniqueness()) {
                for (SchemaSnapshot snapshot : allOf(sourceSnapshots, targetSnapshot)) {
                    duplicates.add(executor.submit(() -> keyUniquenessChecker.findDuplicates(snapshot, k)));
                }
            }
        }
        if (request.wantsProfiles()) {
            for (SchemaSnapshot snapshot : allOf(sourceSnapshots, targetSnapshot)) {
                submittedNames.add(snapshot.dataset().qualifiedName());
                profiles.add(executor.submit(() -> request.isProfileAllColumns()
                        ? aggregateProfiler.profileAll(snapshot, request.getWindow())
                        : aggregateProfiler.profile(snapshot, request.getProfileColumns(), request.getWindow())));
            }
        }

        if (request.getScope().includesSchema()) {
            detectDrift(sourceSnapshots, targetSnapshot, report);
        }

        for (int i = 0; i < rowDiffs.size(); i++) {
            String name = sourceSnapshots.get(i).dataset().qualifiedName();
            collect(await(rowDiffs.get(i), ReconciliationStep.ROWS, name), report, report::rowDiff);
        }
        if (union != null) {
            collect(await(union, ReconciliationStep.UNION, target.qualifiedName()), report, report::unionCoverage);
        }
        List<SchemaSnapshot> all = allOf(sourceSnapshots, targetSnapshot);
        for (int i = 0; i < duplicates.size(); i++) {
            collect(await(duplicates.get(i), ReconciliationStep.KEYS, all.get(i).dataset().qualifiedName()),
                    report, report::duplicateKeys);
        }
        for (int i = 0; i < profiles.size(); i++) {
            collect(await(profiles.get(i), ReconciliationStep.PROFILE, submittedNames.get(i)), report, report::profile);
        }

        return report.build();
    }

    /* ------------------------------------------------------------------ */
    /* Steps                                                               */
    /* ------------------------------------------------------------------ */

    private KeySet resolveKeys(ReconciliationRequest request, List<SchemaSnapshot> sources,
                               SchemaSnapshot target, ReportBuilder report) {
        try {
            if (request.hasExplicitKeys()) {
                KeySet keys = KeySet.explicit(request.getKeyColumns(), target.dataset().qualifiedName());
                log.info("[KEYS] Using explicit key {}", keys.columns());
                return keys;
            }
            return keyInferenceEngine.inferKeys(allOf(sources, target), request.getKeyFallback());
        } catch (ReconciliationException e) {
            log.warn("[KEYS] Key resolution failed: {}", e.getMessage());
            report.failure(ComparisonFailure.of(ReconciliationStep.KEYS, e));
            return null;
        }
    }

    private void detectDrift(List<SchemaSnapshot> sources, SchemaSnapshot target, ReportBuilder report) {
        if (!target.authoritative()) {
            report.failure(ComparisonFailure.of(ReconciliationStep.SCHEMA, new MetadataUnavailableException(
                    target.dataset().qualifiedName(), "schema drift needs the target's catalog metadata")));
            return;
        }
        List<SchemaSnapshot> described = new ArrayList<>();
        for (SchemaSnapshot source : sources) {
            if (source.authoritative()) {
                described.add(source);
            } else {
                report.failure(ComparisonFailure.of(ReconciliationStep.SCHEMA, new MetadataUnavailableException(
                        source.dataset().qualifiedName(), "excluded from the drift check (no catalog metadata)"), true));
            }
        }
        if (described.isEmpty()) {
            return;
        }
        MergedColumns merged = sourceColumnMerger.merge(described);
        report.columnConflicts(merged.conflicts());
        report.schemaDiff(schemaDriftDetector.diff(merged.label(), merged.columns(),
                target.dataset().qualifiedName(), target.columns()));
    }

    private static void summarize(ReportBuilder report, List<DatasetHandle> sources, List<SchemaSnapshot> sourceSnapshots,
                                  Map<DatasetHandle, Long> sourceRowCounts, SchemaSnapshot target, long targetRows) {
        long totalSourceRows = 0;
        for (int i = 0; i < sources.size(); i++) {
            SchemaSnapshot snapshot = sourceSnapshots.get(i);
            Long rows = sourceRowCounts.get(sources.get(i));
            if (rows != null) {
                totalSourceRows += rows;
            }
            report.summary(DatasetSummary.builder()
                    .datasetName(snapshot.dataset().qualifiedName())
                    .role(DatasetSummary.Role.SOURCE)
                    .rowCount(rows)
                    .columnCount(snapshot.columnCount())
                    .columnsInTarget(snapshot.columnNames().stream().filter(target::contains).toList())
                    .columnsMissingFromTarget(snapshot.columnNames().stream().filter(c -> !target.contains(c)).toList())
                    .build());
        }
        report.summary(DatasetSummary.builder()
                .datasetName(target.dataset().qualifiedName())
                .role(DatasetSummary.Role.TARGET)
                .rowCount(targetRows)
                .columnCount(target.columnCount())
                .totalSourceRows(totalSourceRows)
                .rowCountDifference(targetRows - totalSourceRows)
                .build());
    }

    /* ------------------------------------------------------------------ */
    /* Concurrency helpers                                                 */
    /* ------------------------------------------------------------------ */

    private SchemaSnapshot captured(Future<SchemaCapture> future, DatasetHandle dataset,
                                    List<String> fallbackColumns, ReportBuilder report) {
        StepOutcome<SchemaCapture> outcome = await(future, ReconciliationStep.INTROSPECT, dataset.qualifiedName());
        SchemaCapture capture = outcome.succeeded()
                ? outcome.value()
                : new SchemaCapture(SchemaSnapshot.fallback(dataset, fallbackColumns),
                        new MetadataUnavailableException(dataset.qualifiedName(), outcome.failure().message()));
        if (capture.fellBack()) {
            log.warn("[INTROSPECT] {} described from fallback columns {}: {}", dataset, fallbackColumns,
                    capture.failure().getMessage());
            report.failure(ComparisonFailure.of(ReconciliationStep.INTROSPECT, capture.failure(), true));
        }
        return capture.snapshot();
    }

    /**
     * Waits for a step, bounded by the configured step timeout. A timed-out step is cancelled and
     * becomes a query failure; every other exception is converted to a failure of that step.
     */
    private <T> StepOutcome<T> await(Future<T> future, ReconciliationStep step, String dataset) {
        try {
            long timeout = properties.getStepTimeoutSeconds();
            T value = timeout > 0 ? future.get(timeout, TimeUnit.SECONDS) : future.get();
            return StepOutcome.success(value);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} Step on {} exceeded {} s and was cancelled", step.tag(), dataset,
                    properties.getStepTimeoutSeconds());
            return StepOutcome.failed(ComparisonFailure.of(step, new QueryExecutionException(dataset, null, null,
                    String.format("Step timed out after %d s", properties.getStepTimeoutSeconds()), true, e)));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} Step on {} failed: {}", step.tag(), dataset, cause.getMessage());
            return StepOutcome.failed(ComparisonFailure.unexpected(step, dataset, cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return StepOutcome.failed(ComparisonFailure.unexpected(step, dataset, e));
        }
    }

    private static <T> void collect(StepOutcome<T> outcome, ReportBuilder report, Consumer<T> sink) {
        if (outcome.succeeded()) {
            sink.accept(outcome.value());
        } else {
            report.failure(outcome.failure());
        }
    }

    private static Throwable failureCause(Future<?> future) {
        try {
            future.get(0, TimeUnit.MILLISECONDS);
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (TimeoutException e) {
            return e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        } catch (CancellationException e) {
            return e;
        }
    }

    private ExecutorService newRunExecutor(int datasetCount) {
        int threads = Math.max(1, Math.min(properties.getMaxParallelism(), Math.max(2, datasetCount * 2)));
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger thread = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "recon-" + pool + "-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(threads, factory));
    }

    private static List<SchemaSnapshot> allOf(List<SchemaSnapshot> sources, SchemaSnapshot target) {
        List<SchemaSnapshot> all = new ArrayList<>(sources);
        all.add(target);
        return all;
    }

    private static void validate(ReconciliationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Reconciliation request cannot be null");
        }
        if (request.getTarget() == null) {
            throw new IllegalArgumentException("A target dataset is required");
        }
        if (request.getSources().isEmpty()) {
            throw new IllegalArgumentException("At least one source dataset is required");
        }
    }
}
