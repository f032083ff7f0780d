package com.voltscope.sampling;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Coerces raw field values into the doubles used for triangle geometry. Timestamps become epoch milliseconds;
 * values that cannot be read become {@link Double#NaN}.
 */
public final class TimestampCoercion {

    private TimestampCoercion() {}

    public static double toEpochMillis(Object value) {
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof Date date) {
            return date.getTime();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        if (value instanceof LocalDate ld) {
            return ld.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        }
        if (value instanceof TemporalAccessor temporal) {
            try {
                return Instant.from(temporal).toEpochMilli();
            } catch (DateTimeException e) {
                return Double.NaN;
            }
        }
        if (value instanceof CharSequence text) {
            return parseEpochMillis(text.toString());
        }
        return Double.NaN;
    }

    /**
     * Parses ISO-8601 instants, offset or zoned date-times, local date-times (UTC, {@code T} or space separated),
     * local dates (UTC midnight) and plain numeric epoch strings.
     */
    public static double parseEpochMillis(String input) {
        if (input == null || input.isBlank()) {
            return Double.NaN;
        }
        String trimmed = input.trim();
        try {
            return Instant.parse(trimmed).toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // fall through to offset parsing
        }
        try {
            return OffsetDateTime.parse(trimmed).toInstant().toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // fall through to zoned parsing
        }
        try {
            return ZonedDateTime.parse(trimmed).toInstant().toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // fall through to local parsing
        }
        try {
            return LocalDateTime.parse(trimmed.replaceFirst(" ", "T"))
                    .toInstant(ZoneOffset.UTC)
                    .toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // fall through to date-only parsing
        }
        try {
            return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // fall through to numeric parsing
        }
        return toMetric(trimmed);
    }

    /** Metric values: numbers as-is, numeric strings parsed, everything else {@code NaN}. */
    public static double toMetric(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof CharSequence text) {
            try {
                return Double.parseDouble(text.toString().trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}
