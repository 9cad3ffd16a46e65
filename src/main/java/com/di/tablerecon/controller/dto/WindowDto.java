package com.di.tablerecon.controller.dto;

import com.di.tablerecon.profile.ProfileWindow;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Time window for profiling. Either explicit bounds ({@code from}/{@code to}) or a window around
 * today ({@code lookbackDays}/{@code forwardDays}, defaulting to the configured values).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowDto {
    @NotBlank
    private String column;
    private LocalDateTime from;
    private LocalDateTime to;
    @PositiveOrZero
    private Integer lookbackDays;
    @PositiveOrZero
    private Integer forwardDays;

    public ProfileWindow toWindow(int defaultLookbackDays, int defaultForwardDays) {
        if (from != null || to != null) {
            if (from == null || to == null) {
                throw new IllegalArgumentException("Window needs both 'from' and 'to', or neither");
            }
            return new ProfileWindow(column, from, to);
        }
        return ProfileWindow.around(column, LocalDate.now(),
                lookbackDays != null ? lookbackDays : defaultLookbackDays,
                forwardDays != null ? forwardDays : defaultForwardDays);
    }
}
