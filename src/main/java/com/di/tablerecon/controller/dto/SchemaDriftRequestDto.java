package com.di.tablerecon.controller.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/schema-drift}: either two datasets ({@code before}, {@code after}),
 * or one table name compared across two schemas ({@code table}, {@code beforeSchema}, {@code afterSchema}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaDriftRequestDto {
    private String before;
    private String after;
    private String table;
    private String beforeSchema;
    private String afterSchema;

    @AssertTrue(message = "give 'before' and 'after', or 'table' with 'beforeSchema' and 'afterSchema'")
    public boolean isComplete() {
        boolean datasets = notBlank(before) && notBlank(after);
        boolean environments = notBlank(table) && notBlank(beforeSchema) && notBlank(afterSchema);
        return datasets || environments;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
