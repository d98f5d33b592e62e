package com.wrestling.ratings.service;

import com.wrestling.ratings.model.MatchResult;
import com.wrestling.ratings.model.Prediction;
import com.wrestling.ratings.model.RatingPeriod;
import com.wrestling.ratings.model.RatingRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Back-tests candidate tau values and keeps the best calibrated one.
 *
 * Every candidate replays the full period sequence on its own engine; the
 * predictions each run makes before applying a period are scored with the
 * Brier score (lower is better) and accuracy.
 */
@Service
public class TauCalibrationService {

    private static final Logger log = LoggerFactory.getLogger(TauCalibrationService.class);

    private final RatingSimulationService simulationService;

    public TauCalibrationService(RatingSimulationService simulationService) {
        this.simulationService = simulationService;
    }

    /**
     * Pick the candidate with the lowest Brier score. Ties keep the earlier
     * candidate; accuracy is reported but never used to break ties.
     */
    public TauSelection tuneTau(
            List<RatingPeriod> periods,
            List<List<MatchResult>> matchesByPeriod,
            Set<String> wrestlers,
            List<Double> candidates
    ) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one tau candidate is required");
        }

        // Runs are independent, so they may execute concurrently; the ordered
        // stream keeps results in candidate order.
        List<CandidateScore> scores = candidates.parallelStream()
                .map(tau -> {
                    RatingRunResult run = simulationService.runSimulation(periods, matchesByPeriod, wrestlers, tau);
                    Metrics metrics = evaluatePredictions(run.predictions());
                    return new CandidateScore(tau, metrics.brier(), metrics.accuracy(), run.predictions().size());
                })
                .toList();

        CandidateScore best = null;
        for (CandidateScore score : scores) {
            log.info("tau={} -> Brier={}, accuracy={} ({} predictions)",
                    score.tau(), String.format("%.4f", score.brier()),
                    String.format("%.2f%%", score.accuracy() * 100), score.predictions());
            if (best == null || score.brier() < best.brier()) {
                best = score;
            }
        }

        log.info("Tuned tau to {} (Brier={}, accuracy={})",
                best.tau(), String.format("%.4f", best.brier()), String.format("%.2f%%", best.accuracy() * 100));
        return new TauSelection(best.tau(), best.brier(), best.accuracy(), scores);
    }

    /**
     * Brier score and accuracy of a prediction list; (0, 0) when empty.
     */
    public static Metrics evaluatePredictions(List<Prediction> predictions) {
        if (predictions.isEmpty()) {
            return new Metrics(0.0, 0.0);
        }
        double squaredError = 0.0;
        int correct = 0;
        for (Prediction prediction : predictions) {
            squaredError += prediction.squaredError();
            if (prediction.isCorrect()) {
                correct++;
            }
        }
        return new Metrics(squaredError / predictions.size(), (double) correct / predictions.size());
    }

    // ============ RESULT RECORDS ============

    public record Metrics(double brier, double accuracy) {}

    public record CandidateScore(double tau, double brier, double accuracy, int predictions) {}

    public record TauSelection(
            double tau,
            double brier,
            double accuracy,
            List<CandidateScore> candidates
    ) {
        public String getAccuracyPercent() {
            return String.format("%.1f%%", accuracy * 100);
        }
    }
}
