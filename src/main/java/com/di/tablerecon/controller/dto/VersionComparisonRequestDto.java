package com.di.tablerecon.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/version-comparisons}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionComparisonRequestDto {
    @NotBlank
    private String oldVersion;
    @NotBlank
    private String newVersion;
    @NotEmpty
    private List<String> keyColumns;
    /** Non-key columns to compare; omit for every common column. */
    private List<String> columns;
}
