package com.di.tablerecon.controller.dto;

import com.di.tablerecon.key.KeyFallbackStrategy;
import com.di.tablerecon.report.ComparisonScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/reconciliations}. Dataset names are {@code table} or {@code schema.table};
 * profile columns are {@code column} or {@code column:type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationRequestDto {
    @NotEmpty
    private List<@NotBlank String> sources;
    @NotBlank
    private String target;
    /** Omit to infer; an empty list is reported as an empty key set. */
    private List<String> keyColumns;
    private ComparisonScope scope;
    private List<String> profileColumns;
    private boolean profileAllColumns;
    private List<String> requiredColumns;
    private List<String> fallbackColumns;
    private boolean verifyKeyUniqueness;
    private KeyFallbackStrategy keyFallback;
    @Valid
    private WindowDto window;
}
