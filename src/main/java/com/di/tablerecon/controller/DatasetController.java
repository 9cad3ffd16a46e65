package com.di.tablerecon.controller;

import com.di.tablerecon.config.ReconciliationProperties;
import com.di.tablerecon.controller.dto.AggregationRequestDto;
import com.di.tablerecon.controller.dto.DateDistributionRequestDto;
import com.di.tablerecon.controller.dto.DistributionShiftRequestDto;
import com.di.tablerecon.controller.dto.ProfileRequestDto;
import com.di.tablerecon.controller.dto.SchemaDriftRequestDto;
import com.di.tablerecon.controller.dto.WindowDto;
import com.di.tablerecon.dataset.DatasetHandle;
import com.di.tablerecon.drift.SchemaDiff;
import com.di.tablerecon.drift.SchemaDriftDetector;
import com.di.tablerecon.profile.AggregateProfiler;
import com.di.tablerecon.profile.ColumnShift;
import com.di.tablerecon.profile.ColumnSpec;
import com.di.tablerecon.profile.DateDistribution;
import com.di.tablerecon.profile.DatePart;
import com.di.tablerecon.profile.GroupAggregate;
import com.di.tablerecon.profile.ProfileResult;
import com.di.tablerecon.profile.ProfileWindow;
import com.di.tablerecon.schema.SchemaCapture;
import com.di.tablerecon.schema.SchemaIntrospector;
import com.di.tablerecon.schema.SchemaSnapshot;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-dataset inspection: schema, drift, profiles, aggregates and distributions.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DatasetController {

    private final SchemaIntrospector schemaIntrospector;
    private final SchemaDriftDetector schemaDriftDetector;
    private final AggregateProfiler aggregateProfiler;
    private final ReconciliationProperties properties;

    /**
     * Example: GET /api/datasets/staging.orders/schema
     */
    @GetMapping(value = "/datasets/{dataset}/schema", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SchemaSnapshot> describe(@PathVariable String dataset) {
        return ResponseEntity.ok(schemaIntrospector.describe(handle(dataset)));
    }

    @PostMapping(value = "/schema-drift", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SchemaDiff> schemaDrift(@Valid @RequestBody SchemaDriftRequestDto body) {
        DatasetHandle before;
        DatasetHandle after;
        if (body.getBefore() != null && !body.getBefore().isBlank()) {
            before = handle(body.getBefore());
            after = handle(body.getAfter());
        } else {
            before = DatasetHandle.of(body.getBeforeSchema(), body.getTable());
            after = DatasetHandle.of(body.getAfterSchema(), body.getTable());
        }
        return ResponseEntity.ok(schemaDriftDetector.diff(schemaIntrospector.describe(before),
                schemaIntrospector.describe(after)));
    }

    @PostMapping(value = "/profiles", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProfileResult> profile(@Valid @RequestBody ProfileRequestDto body) {
        ProfileWindow window = window(body.getWindow());
        List<ColumnSpec> specs = body.getColumns() == null ? List.of()
                : body.getColumns().stream().map(ColumnSpec::parse).toList();
        List<String> fallback = new ArrayList<>(specs.stream().map(ColumnSpec::name).toList());
        if (window != null) {
            fallback.add(window.column());
        }
        SchemaSnapshot snapshot = snapshot(body.getDataset(), fallback);
        ProfileResult result = specs.isEmpty()
                ? aggregateProfiler.profileAll(snapshot, window)
                : aggregateProfiler.profile(snapshot, specs, window);
        return ResponseEntity.ok(result);
    }

    @PostMapping(value = "/aggregations", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<GroupAggregate>> aggregate(@Valid @RequestBody AggregationRequestDto body) {
        ProfileWindow window = window(body.getWindow());
        List<String> fallback = new ArrayList<>(List.of(body.getGroupColumn()));
        if (body.getMeasureColumn() != null) {
            fallback.add(body.getMeasureColumn());
        }
        if (window != null) {
            fallback.add(window.column());
        }
        SchemaSnapshot snapshot = snapshot(body.getDataset(), fallback);
        return ResponseEntity.ok(aggregateProfiler.aggregateBy(snapshot, body.getGroupColumn(),
                body.getMeasureColumn(), body.getStats(), window));
    }

    @PostMapping(value = "/date-distributions", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DateDistribution> dateDistribution(@Valid @RequestBody DateDistributionRequestDto body) {
        ProfileWindow window = window(body.getWindow());
        SchemaSnapshot snapshot = snapshot(body.getDataset(), List.of(body.getDateColumn()));
        DatePart part = body.getDatePart() != null ? body.getDatePart() : DatePart.MONTH;
        return ResponseEntity.ok(aggregateProfiler.dateDistribution(snapshot, body.getDateColumn(), part, window));
    }

    @PostMapping(value = "/distribution-shifts", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ColumnShift>> distributionShift(@Valid @RequestBody DistributionShiftRequestDto body) {
        List<String> fallback = body.getColumns() == null ? List.of() : body.getColumns();
        return ResponseEntity.ok(aggregateProfiler.compareDistributions(
                snapshot(body.getBefore(), fallback), snapshot(body.getAfter(), fallback), body.getColumns()));
    }

    private SchemaSnapshot snapshot(String dataset, List<String> fallbackColumns) {
        SchemaCapture capture = SchemaCapture.capture(schemaIntrospector, handle(dataset), fallbackColumns);
        if (capture.fellBack()) {
            log.warn("[INTROSPECT] {}; continuing with columns {}", capture.failure().getMessage(), fallbackColumns);
        }
        return capture.snapshot();
    }

    private ProfileWindow window(WindowDto window) {
        return window == null ? null : window.toWindow(
                properties.getWindow().getLookbackDays(), properties.getWindow().getForwardDays());
    }

    private DatasetHandle handle(String name) {
        return DatasetHandle.parse(name).resolve(properties.getDefaultSchema());
    }
}
