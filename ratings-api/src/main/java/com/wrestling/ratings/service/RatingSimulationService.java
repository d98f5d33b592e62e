package com.wrestling.ratings.service;

import com.wrestling.ratings.config.RatingsProperties;
import com.wrestling.ratings.model.HeadToHead;
import com.wrestling.ratings.model.MatchResult;
import com.wrestling.ratings.model.Prediction;
import com.wrestling.ratings.model.RatingPeriod;
import com.wrestling.ratings.model.RatingRunResult;
import com.wrestling.ratings.model.WeightClassUsage;
import com.wrestling.ratings.util.DateParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the Glicko-2 engine across an ordered period sequence.
 *
 * Before each period, RD grows for the calendar gap since the previous
 * period ended, and is raised to the season floor when the season label
 * changes. Every call builds a fresh engine, so concurrent runs never share state.
 */
@Service
public class RatingSimulationService {

    private static final Logger log = LoggerFactory.getLogger(RatingSimulationService.class);

    private final RatingsProperties properties;

    public RatingSimulationService(RatingsProperties properties) {
        this.properties = properties;
    }

    public RatingRunResult runSimulation(
            List<RatingPeriod> periods,
            List<List<MatchResult>> matchesByPeriod,
            Iterable<String> wrestlers,
            double tau
    ) {
        if (periods.size() != matchesByPeriod.size()) {
            throw new IllegalArgumentException(String.format(
                    "Expected one match bucket per period (%d periods, %d buckets)",
                    periods.size(), matchesByPeriod.size()));
        }

        Glicko2Engine engine = newEngine(tau);
        for (String wrestlerId : wrestlers) {
            engine.ensurePlayer(wrestlerId);
        }

        HeadToHead headToHead = new HeadToHead();
        WeightClassUsage weightUsage = new WeightClassUsage(engine.getWeightHistoryLimit());
        List<Prediction> predictions = new ArrayList<>();

        LocalDate previousEnd = null;
        String previousSeason = null;
        for (int i = 0; i < periods.size(); i++) {
            RatingPeriod period = periods.get(i);
            if (previousEnd != null) {
                engine.inflateForGap(DateParsing.monthsBetween(previousEnd, period.start()));
            }
            if (!Objects.equals(period.season(), previousSeason)) {
                engine.resetRdForSeason();
                previousSeason = period.season();
            }
            predictions.addAll(engine.processPeriod(matchesByPeriod.get(i), headToHead, weightUsage));
            previousEnd = period.end();
        }

        log.debug("Simulation tau={} finished: {} wrestlers, {} predictions",
                tau, engine.getStates().size(), predictions.size());

        return new RatingRunResult(engine.getStates(), headToHead, weightUsage, predictions);
    }

    Glicko2Engine newEngine(double tau) {
        return new Glicko2Engine(
                tau,
                properties.getMinRd(),
                properties.getMaxRd(),
                properties.getSeasonRdFloor(),
                properties.getWeightHistoryLimit()
        );
    }
}
