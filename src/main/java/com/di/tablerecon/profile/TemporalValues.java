package com.di.tablerecon.profile;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Normalizes the date/time objects JDBC drivers return.
 */
final class TemporalValues {

    private TemporalValues() {}

    /**
     * Returns a {@link LocalDate} for date values, a {@link LocalDateTime} for timestamps
     * (offset values converted to UTC), a {@link java.time.LocalTime} for time-of-day values,
     * or the value unchanged when it is none of these.
     */
    static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof java.sql.Date d) {
            return d.toLocalDate();
        }
        if (value instanceof java.sql.Time t) {
            return t.toLocalTime();
        }
        if (value instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof java.util.Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
        }
        return value;
    }

    static LocalDate toLocalDate(Object value) {
        Object normalized = normalize(value);
        if (normalized instanceof LocalDate d) {
            return d;
        }
        if (normalized instanceof LocalDateTime dt) {
            return dt.toLocalDate();
        }
        return null;
    }

    /** Whole days between the calendar dates of two values; null when either has no date part. */
    static Long spanDays(Object min, Object max) {
        LocalDate from = toLocalDate(min);
        LocalDate to = toLocalDate(max);
        if (from == null || to == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(from, to);
    }
}
