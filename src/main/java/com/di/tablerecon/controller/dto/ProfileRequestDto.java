package com.di.tablerecon.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/profiles}. Omit {@code columns} to profile every column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileRequestDto {
    @NotBlank
    private String dataset;
    private List<String> columns;
    @Valid
    private WindowDto window;
}
