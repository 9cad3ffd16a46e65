package com.di.tablerecon.profile;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Bucket width of a date distribution; {@link #sqlName()} is the {@code date_trunc} part.
 */
public enum DatePart {
    DAY,
    MONTH,
    QUARTER,
    YEAR;

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    public String sqlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Human-readable label of the period starting at {@code periodStart}. */
    public String label(LocalDate periodStart) {
        return switch (this) {
            case DAY -> periodStart.toString();
            case MONTH -> periodStart.format(MONTH_FORMAT);
            case QUARTER -> periodStart.getYear() + "-Q" + ((periodStart.getMonthValue() - 1) / 3 + 1);
            case YEAR -> String.valueOf(periodStart.getYear());
        };
    }
}
