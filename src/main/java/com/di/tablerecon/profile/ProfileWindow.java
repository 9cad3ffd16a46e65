package com.di.tablerecon.profile;

import com.di.tablerecon.util.InputValidator;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Half-open time window {@code [fromInclusive, toExclusive)} over one temporal column.
 */
public record ProfileWindow(String column, LocalDateTime fromInclusive, LocalDateTime toExclusive) {

    public ProfileWindow {
        column = InputValidator.validateColumnName(column);
        if (fromInclusive == null || toExclusive == null) {
            throw new IllegalArgumentException("Window bounds cannot be null");
        }
        if (!fromInclusive.isBefore(toExclusive)) {
            throw new IllegalArgumentException(String.format(
                    "Window start %s must be before end %s", fromInclusive, toExclusive));
        }
    }

    /**
     * Window from {@code lookbackDays} before {@code today} up to {@code forwardDays} after it.
     */
    public static ProfileWindow around(String column, LocalDate today, int lookbackDays, int forwardDays) {
        if (lookbackDays < 0 || forwardDays < 0) {
            throw new IllegalArgumentException("Lookback and forward days must not be negative");
        }
        return new ProfileWindow(column,
                today.minusDays(lookbackDays).atStartOfDay(),
                today.plusDays(forwardDays).atStartOfDay());
    }

    @Override
    public String toString() {
        return column + " in [" + fromInclusive + ", " + toExclusive + ")";
    }
}
