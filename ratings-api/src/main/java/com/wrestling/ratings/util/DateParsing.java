package com.wrestling.ratings.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Lenient parsing of the date strings stored by the scraper.
 * Accepts plain ISO dates, ISO instants ("...Z"), offset and local date-times;
 * values carrying an offset are converted to their UTC calendar date.
 */
public final class DateParsing {

    private DateParsing() {}

    public static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();

        if (text.length() == 10) {
            try {
                return Optional.of(LocalDate.parse(text));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // fall through to the other formats
        }
        try {
            return Optional.of(Instant.parse(text).atOffset(ZoneOffset.UTC).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }

    /**
     * Approximate number of months between two dates (days / 30). Zero when
     * {@code second} is not after {@code first}.
     */
    public static double monthsBetween(LocalDate first, LocalDate second) {
        if (!second.isAfter(first)) {
            return 0.0;
        }
        long days = second.toEpochDay() - first.toEpochDay();
        return days / 30.0;
    }
}
