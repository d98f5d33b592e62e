package com.wrestling.ratings.model;

import java.time.LocalDate;

/**
 * A monthly slice of a season. All matches inside {@code [start, end)} are
 * applied as one simultaneous Glicko-2 batch.
 */
public record RatingPeriod(
        LocalDate start,
        LocalDate end,
        String season
) {
    public RatingPeriod {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Rating period must satisfy start < end: " + start + " / " + end);
        }
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && date.isBefore(end);
    }
}
