package com.di.tablerecon.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/distribution-shifts}. Omit {@code columns} for every common column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionShiftRequestDto {
    @NotBlank
    private String before;
    @NotBlank
    private String after;
    private List<String> columns;
}
