package com.wrestling.ratings.service;

import com.wrestling.ratings.model.MatchResult;
import com.wrestling.ratings.model.readonly.EventDocument;
import com.wrestling.ratings.model.readonly.MatchDocument;
import com.wrestling.ratings.repository.readonly.EventReadRepository;
import com.wrestling.ratings.repository.readonly.MatchReadRepository;
import com.wrestling.ratings.util.DateParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads bouts from the scraped collections and turns them into engine input.
 *
 * A bout without its own date takes the date of its event. Bouts are kept
 * when at least one participant is on the roster and, if a weight filter is
 * given, when their weight class is in it.
 */
@Service
public class MatchFeedService {

    private static final Logger log = LoggerFactory.getLogger(MatchFeedService.class);

    private final MatchReadRepository matchRepository;
    private final EventReadRepository eventRepository;

    public MatchFeedService(MatchReadRepository matchRepository, EventReadRepository eventRepository) {
        this.matchRepository = matchRepository;
        this.eventRepository = eventRepository;
    }

    /**
     * @param start         first date, inclusive
     * @param endExclusive  last date, exclusive
     * @param roster        wrestlers whose bouts are wanted
     * @param weightFilter  weight classes to keep, null for all
     * @return matches in (date, id) order
     */
    public List<MatchResult> loadMatches(
            LocalDate start,
            LocalDate endExclusive,
            Set<String> roster,
            Set<String> weightFilter
    ) {
        String from = start.toString();
        String to = endExclusive.toString();

        List<MatchResult> results = new ArrayList<>();
        int skipped = 0;

        for (MatchDocument doc : matchRepository.findByDateRange(from, to)) {
            Optional<MatchResult> match = toMatchResult(doc, doc.getDate(), start, endExclusive, roster, weightFilter);
            if (match.isPresent()) {
                results.add(match.get());
            } else {
                skipped++;
            }
        }

        Map<String, String> eventDates = new HashMap<>();
        for (EventDocument event : eventRepository.findByDateRange(from, to)) {
            eventDates.put(event.getId(), event.getDate());
        }
        if (!eventDates.isEmpty()) {
            for (MatchDocument doc : matchRepository.findUndatedByEventIds(eventDates.keySet())) {
                String eventDate = eventDates.get(doc.getEventId());
                Optional<MatchResult> match = toMatchResult(doc, eventDate, start, endExclusive, roster, weightFilter);
                if (match.isPresent()) {
                    results.add(match.get());
                } else {
                    skipped++;
                }
            }
        }

        results.sort(MatchBucketer.CHRONOLOGICAL);
        log.info("Loaded {} matches between {} and {} ({} skipped)", results.size(), start, endExclusive, skipped);
        return results;
    }

    private Optional<MatchResult> toMatchResult(
            MatchDocument doc,
            String rawDate,
            LocalDate start,
            LocalDate endExclusive,
            Set<String> roster,
            Set<String> weightFilter
    ) {
        if (doc.getTopId() == null || doc.getBottomId() == null) {
            log.debug("Skipping match {}: missing participant", doc.getId());
            return Optional.empty();
        }
        if (!roster.contains(doc.getTopId()) && !roster.contains(doc.getBottomId())) {
            return Optional.empty();
        }
        if (weightFilter != null && !weightFilter.contains(doc.getWeightClass())) {
            return Optional.empty();
        }

        Optional<LocalDate> date = DateParsing.parseDate(rawDate);
        if (date.isEmpty()) {
            log.debug("Skipping match {}: unparseable date '{}'", doc.getId(), rawDate);
            return Optional.empty();
        }
        // Offsets can move a stored timestamp across the range boundary
        if (date.get().isBefore(start) || !date.get().isBefore(endExclusive)) {
            return Optional.empty();
        }

        return Optional.of(new MatchResult(
                doc.getId(),
                date.get(),
                doc.getTopId(),
                doc.getBottomId(),
                doc.getWinnerId(),
                doc.getWinType(),
                doc.getWeightClass()
        ));
    }
}
