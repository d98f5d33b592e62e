package com.wrestling.ratings.service;

import com.wrestling.ratings.model.RatingPeriod;
import com.wrestling.ratings.model.readonly.SeasonDocument;
import com.wrestling.ratings.repository.readonly.SeasonReadRepository;
import com.wrestling.ratings.util.DateParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Splits seasons into monthly rating periods.
 *
 * Each season runs from its regular-season start to the day after its
 * postseason end (periods are half-open). Seasons are clipped to the optional
 * overrides and to today, so no period ever lies in the future.
 */
@Service
public class RatingPeriodService {

    private static final Logger log = LoggerFactory.getLogger(RatingPeriodService.class);

    private final SeasonReadRepository seasonRepository;
    private final Clock clock;

    public RatingPeriodService(SeasonReadRepository seasonRepository, Clock clock) {
        this.seasonRepository = seasonRepository;
        this.clock = clock;
    }

    /**
     * Build periods from the stored seasons.
     *
     * @param seasonFilter   season names to keep, null or empty for all
     * @param startOverride  earliest start, inclusive (nullable)
     * @param endOverride    latest end, exclusive (nullable)
     */
    public List<RatingPeriod> buildPeriods(Set<String> seasonFilter, LocalDate startOverride, LocalDate endOverride) {
        return buildPeriods(seasonRepository.findAll(), seasonFilter, startOverride, endOverride);
    }

    public List<RatingPeriod> buildPeriods(
            List<SeasonDocument> seasons,
            Set<String> seasonFilter,
            LocalDate startOverride,
            LocalDate endOverride
    ) {
        List<RatingPeriod> periods = new ArrayList<>();
        // Today's matches are included: the bound is exclusive
        LocalDate horizon = LocalDate.now(clock).plusDays(1);

        for (SeasonDocument season : seasons) {
            String seasonName = season.getName() != null ? season.getName() : "unknown";
            if (seasonFilter != null && !seasonFilter.isEmpty() && !seasonFilter.contains(seasonName)) {
                continue;
            }

            Optional<LocalDate> startDate = DateParsing.parseDate(season.getRegularStartDate());
            Optional<LocalDate> endDate = DateParsing.parseDate(season.getPostEndDate());
            if (startDate.isEmpty() || endDate.isEmpty()) {
                log.warn("Skipping season {}: missing or invalid boundary dates (start={}, end={})",
                        seasonName, season.getRegularStartDate(), season.getPostEndDate());
                continue;
            }

            LocalDate seasonStart = startDate.get();
            LocalDate seasonEnd = endDate.get().plusDays(1);

            if (startOverride != null && startOverride.isAfter(seasonStart)) {
                seasonStart = startOverride;
            }
            if (endOverride != null && endOverride.isBefore(seasonEnd)) {
                seasonEnd = endOverride;
            }
            if (horizon.isBefore(seasonEnd)) {
                seasonEnd = horizon;
            }

            if (!seasonStart.isBefore(seasonEnd)) {
                log.debug("Season {} has no range left after clipping", seasonName);
                continue;
            }

            periods.addAll(monthPeriods(seasonStart, seasonEnd, seasonName));
        }

        log.info("Built {} rating periods from {} seasons", periods.size(), seasons.size());
        return periods;
    }

    /**
     * Consecutive calendar-month segments covering {@code [start, end)}. Each
     * segment ends on the same day-of-month one month later (or the last day of
     * a shorter month); the last segment is cut at {@code end}.
     */
    static List<RatingPeriod> monthPeriods(LocalDate start, LocalDate end, String season) {
        List<RatingPeriod> periods = new ArrayList<>();
        LocalDate current = start;
        while (current.isBefore(end)) {
            LocalDate next = current.plusMonths(1);
            if (next.isAfter(end)) {
                next = end;
            }
            periods.add(new RatingPeriod(current, next, season));
            current = next;
        }
        return periods;
    }
}
