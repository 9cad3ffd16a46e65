package com.di.tablerecon.controller.dto;

import com.di.tablerecon.profile.AggregateStat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/aggregations}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationRequestDto {
    @NotBlank
    private String dataset;
    @NotBlank
    private String groupColumn;
    private String measureColumn;
    private List<AggregateStat> stats;
    @Valid
    private WindowDto window;
}
