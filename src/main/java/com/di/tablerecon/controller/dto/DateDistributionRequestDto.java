package com.di.tablerecon.controller.dto;

import com.di.tablerecon.profile.DatePart;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/date-distributions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DateDistributionRequestDto {
    @NotBlank
    private String dataset;
    @NotBlank
    private String dateColumn;
    /** Defaults to MONTH. */
    private DatePart datePart;
    @Valid
    private WindowDto window;
}
