package com.wrestling.ratings.service;

import com.wrestling.ratings.model.MatchResult;
import com.wrestling.ratings.model.RatingPeriod;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assigns matches to rating periods in one forward sweep.
 *
 * Matches falling between periods (off-season gaps) or after the last period
 * are dropped. The input is re-sorted by (date, id) first; the sweep is only
 * correct on sorted input.
 */
public final class MatchBucketer {

    static final Comparator<MatchResult> CHRONOLOGICAL =
            Comparator.comparing(MatchResult::date).thenComparing(MatchResult::id, Comparator.nullsFirst(Comparator.naturalOrder()));

    private MatchBucketer() {}

    /**
     * @return one bucket per period, same length and order as {@code periods}
     */
    public static List<List<MatchResult>> bucket(List<RatingPeriod> periods, List<MatchResult> matches) {
        List<List<MatchResult>> buckets = new ArrayList<>(periods.size());
        for (int i = 0; i < periods.size(); i++) {
            buckets.add(new ArrayList<>());
        }
        if (periods.isEmpty()) {
            return buckets;
        }

        List<MatchResult> sorted = matches.stream()
                .filter(match -> match.date() != null)
                .sorted(CHRONOLOGICAL)
                .toList();

        int periodIdx = 0;
        for (MatchResult match : sorted) {
            while (periodIdx < periods.size() && !match.date().isBefore(periods.get(periodIdx).end())) {
                periodIdx++;
            }
            if (periodIdx >= periods.size()) {
                break;
            }
            if (!match.date().isBefore(periods.get(periodIdx).start())) {
                buckets.get(periodIdx).add(match);
            }
        }
        return buckets;
    }
}
