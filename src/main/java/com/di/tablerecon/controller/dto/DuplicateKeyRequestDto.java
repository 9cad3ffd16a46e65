package com.di.tablerecon.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/duplicate-keys}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateKeyRequestDto {
    @NotBlank
    private String dataset;
    @NotEmpty
    private List<String> keyColumns;
}
