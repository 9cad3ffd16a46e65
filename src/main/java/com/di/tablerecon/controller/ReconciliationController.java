package com.di.tablerecon.controller;

import com.di.tablerecon.config.ReconciliationProperties;
import com.di.tablerecon.controller.dto.DuplicateKeyRequestDto;
import com.di.tablerecon.controller.dto.ReconciliationRequestDto;
import com.di.tablerecon.controller.dto.VersionComparisonRequestDto;
import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.engine.ReconciliationEngine;
import com.di.tablerecon.engine.ReconciliationRequest;
import com.di.tablerecon.engine.ReconciliationResult;
import com.di.tablerecon.key.KeySet;
import com.di.tablerecon.profile.ColumnSpec;
import com.di.tablerecon.report.ComparisonScope;
import com.di.tablerecon.rows.DuplicateKeyResult;
import com.di.tablerecon.rows.KeyUniquenessChecker;
import com.di.tablerecon.rows.RowReconciliationEngine;
import com.di.tablerecon.rows.VersionComparisonResult;
import com.di.tablerecon.schema.SchemaCapture;
import com.di.tablerecon.schema.SchemaIntrospector;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Reconciliation runs and key-based comparisons.
 *
 * Example: POST /api/reconciliations
 * <pre>{@code
 * {"sources": ["staging.orders_eu", "staging.orders_us"], "target": "mart.orders",
 *  "scope": "FULL", "verifyKeyUniqueness": true}
 * }</pre>
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationEngine reconciliationEngine;
    private final RowReconciliationEngine rowReconciliationEngine;
    private final KeyUniquenessChecker keyUniquenessChecker;
    private final SchemaIntrospector schemaIntrospector;
    private final ReconciliationProperties properties;

    @PostMapping(value = "/reconciliations", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReconciliationResult> reconcile(@Valid @RequestBody ReconciliationRequestDto body) {
        ReconciliationRequest request = ReconciliationRequest.builder()
                .sources(body.getSources().stream().map(DatasetHandle::parse).toList())
                .target(DatasetHandle.parse(body.getTarget()))
                .keyColumns(body.getKeyColumns())
                .scope(body.getScope() != null ? body.getScope() : ComparisonScope.FULL)
                .profileColumns(body.getProfileColumns() == null ? List.of()
                        : body.getProfileColumns().stream().map(ColumnSpec::parse).toList())
                .profileAllColumns(body.isProfileAllColumns())
                .requiredColumns(body.getRequiredColumns())
                .fallbackColumns(body.getFallbackColumns())
                .verifyKeyUniqueness(body.isVerifyKeyUniqueness())
                .keyFallback(body.getKeyFallback())
                .window(body.getWindow() == null ? null : body.getWindow().toWindow(
                        properties.getWindow().getLookbackDays(), properties.getWindow().getForwardDays()))
                .build();
        return ResponseEntity.ok(reconciliationEngine.run(request));
    }

    @PostMapping(value = "/version-comparisons", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<VersionComparisonResult> compareVersions(@Valid @RequestBody VersionComparisonRequestDto body) {
        KeySet keys = KeySet.explicit(body.getKeyColumns(), body.getOldVersion() + " -> " + body.getNewVersion());
        VersionComparisonResult result = rowReconciliationEngine.compareVersions(
                handle(body.getOldVersion()), handle(body.getNewVersion()),
                keys, body.getColumns());
        return ResponseEntity.ok(result);
    }

    @PostMapping(value = "/duplicate-keys", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DuplicateKeyResult> findDuplicates(@Valid @RequestBody DuplicateKeyRequestDto body) {
        KeySet keys = KeySet.explicit(body.getKeyColumns(), body.getDataset());
        SchemaCapture capture = SchemaCapture.capture(schemaIntrospector, handle(body.getDataset()),
                keys.columns());
        if (capture.fellBack()) {
            log.warn("[KEYS] {}", capture.failure().getMessage());
        }
        return ResponseEntity.ok(keyUniquenessChecker.findDuplicates(capture.snapshot(), keys));
    }

    private DatasetHandle handle(String name) {
        return DatasetHandle.parse(name).resolve(properties.getDefaultSchema());
    }
}
