package com.wrestling.ratings.service;

import com.wrestling.ratings.exception.RatingConvergenceException;
import com.wrestling.ratings.model.HeadToHead;
import com.wrestling.ratings.model.MatchResult;
import com.wrestling.ratings.model.Prediction;
import com.wrestling.ratings.model.RatingState;
import com.wrestling.ratings.model.WeightClassUsage;
import com.wrestling.ratings.model.WinType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Glicko-2 rating engine for one simulation run.
 *
 * Owns the rating state of every wrestler it has seen. Not thread-safe and not
 * shared: every run (including each tau candidate during calibration) builds
 * its own engine.
 *
 * Results inside a period are weighted by {@link WinType}, so a pin moves
 * ratings more than a decision.
 */
public class Glicko2Engine {

    // Glicko-1 to Glicko-2 scale factor (400 / ln 10)
    static final double SCALE = 173.7178;

    public static final double DEFAULT_MIN_RD = 30.0;
    public static final double DEFAULT_MAX_RD = 350.0;
    public static final double DEFAULT_SEASON_RD_FLOOR = 150.0;

    private final double tau;
    private final double minRd;
    private final double maxRd;
    private final double seasonRdFloor;
    private final int weightHistoryLimit;

    private Map<String, RatingState> states = new LinkedHashMap<>();

    public Glicko2Engine(double tau) {
        this(tau, DEFAULT_MIN_RD, DEFAULT_MAX_RD, DEFAULT_SEASON_RD_FLOOR, WeightClassUsage.DEFAULT_HISTORY_LIMIT);
    }

    public Glicko2Engine(double tau, double minRd, double maxRd, double seasonRdFloor, int weightHistoryLimit) {
        VolatilitySolver.requireValidTau(tau);
        if (minRd <= 0 || maxRd < minRd) {
            throw new IllegalArgumentException("Invalid RD bounds: [" + minRd + ", " + maxRd + "]");
        }
        this.tau = tau;
        this.minRd = minRd;
        this.maxRd = maxRd;
        this.seasonRdFloor = seasonRdFloor;
        this.weightHistoryLimit = Math.max(1, weightHistoryLimit);
    }

    // ============ STATE ============

    /**
     * Create the default state for an unseen wrestler. Existing state is left alone.
     */
    public void ensurePlayer(String wrestlerId) {
        states.putIfAbsent(wrestlerId, RatingState.initial());
    }

    public RatingState getState(String wrestlerId) {
        return states.get(wrestlerId);
    }

    public Map<String, RatingState> getStates() {
        return Collections.unmodifiableMap(states);
    }

    public double getTau() {
        return tau;
    }

    public int getWeightHistoryLimit() {
        return weightHistoryLimit;
    }

    // ============ PROBABILITY ============

    /**
     * Expected score of {@code player} against {@code opponent}. Pure.
     */
    public double winProbability(RatingState player, RatingState opponent) {
        double mu = toMu(player.rating());
        double muJ = toMu(opponent.rating());
        double phiJ = opponent.rd() / SCALE;
        return expected(mu, muJ, phiJ);
    }

    public double winProbability(String wrestlerId, String opponentId) {
        RatingState player = states.getOrDefault(wrestlerId, RatingState.initial());
        RatingState opponent = states.getOrDefault(opponentId, RatingState.initial());
        return winProbability(player, opponent);
    }

    // ============ UNCERTAINTY GROWTH ============

    /**
     * Widen every wrestler's RD for {@code months} of inactivity, driven by volatility.
     */
    public void inflateForGap(double months) {
        if (months <= 0) {
            return;
        }
        states.replaceAll((id, state) -> {
            double phi = state.rd() / SCALE;
            double inflated = Math.sqrt(phi * phi + months * state.sigma() * state.sigma());
            return state.withRd(clampRd(inflated * SCALE));
        });
    }

    /**
     * Raise every RD to at least the season floor. Never lowers an RD.
     */
    public void resetRdForSeason() {
        double floor = Math.max(minRd, Math.min(maxRd, seasonRdFloor));
        states.replaceAll((id, state) -> state.withRd(Math.min(maxRd, Math.max(state.rd(), floor))));
    }

    // ============ PERIOD UPDATE ============

    /**
     * Apply one rating period.
     *
     * Every result is computed against the opponent's state at the start of the
     * period, so the order of matches only affects the order of the returned
     * predictions.
     *
     * @return (probability, actual) for the top wrestler of each rated match, in match order
     */
    public List<Prediction> processPeriod(List<MatchResult> matches, HeadToHead headToHead, WeightClassUsage weightUsage) {
        Map<String, List<GameResult>> resultsByWrestler = new HashMap<>();
        List<Prediction> predictions = new ArrayList<>();

        for (MatchResult match : matches) {
            if (!match.isRated()) {
                continue;
            }

            ensurePlayer(match.topId());
            ensurePlayer(match.bottomId());

            weightUsage.record(match.topId(), match.weightClass());
            weightUsage.record(match.bottomId(), match.weightClass());

            RatingState top = states.get(match.topId());
            RatingState bottom = states.get(match.bottomId());

            double probTop = winProbability(top, bottom);
            double actualTop = match.topWon() ? 1.0 : 0.0;
            predictions.add(new Prediction(probTop, actualTop));

            double weight = WinType.fromCode(match.winType()).weight();
            resultsByWrestler.computeIfAbsent(match.topId(), id -> new ArrayList<>())
                    .add(new GameResult(bottom, actualTop, weight));
            resultsByWrestler.computeIfAbsent(match.bottomId(), id -> new ArrayList<>())
                    .add(new GameResult(top, 1.0 - actualTop, weight));

            headToHead.recordWin(match.winnerId(), match.loserId());
        }

        Map<String, RatingState> updated = new LinkedHashMap<>();
        for (Map.Entry<String, RatingState> entry : states.entrySet()) {
            List<GameResult> results = resultsByWrestler.getOrDefault(entry.getKey(), List.of());
            updated.put(entry.getKey(), updatePlayer(entry.getValue(), results));
        }
        states = updated;

        return predictions;
    }

    /**
     * Per-player Glicko-2 update for one period.
     */
    RatingState updatePlayer(RatingState player, List<GameResult> results) {
        double mu = toMu(player.rating());
        double phi = player.rd() / SCALE;
        double phiStar = Math.sqrt(phi * phi + player.sigma() * player.sigma());

        if (results.isEmpty()) {
            return new RatingState(player.rating(), clampRd(phiStar * SCALE), player.sigma());
        }

        double vInverse = 0.0;
        double scoreResidual = 0.0;
        for (GameResult result : results) {
            double muJ = toMu(result.opponent().rating());
            double phiJ = result.opponent().rd() / SCALE;
            double g = g(phiJ);
            double e = expected(mu, muJ, phiJ);
            vInverse += result.weight() * g * g * e * (1 - e);
            scoreResidual += result.weight() * g * (result.score() - e);
        }

        if (!(vInverse > 0) || !Double.isFinite(vInverse)) {
            return new RatingState(player.rating(), clampRd(phiStar * SCALE), player.sigma());
        }

        double v = 1.0 / vInverse;
        double delta = v * scoreResidual;

        double sigmaPrime = VolatilitySolver.solve(delta, phiStar, v, tau, player.sigma());
        double phiPrime = 1.0 / Math.sqrt(1.0 / (phiStar * phiStar + sigmaPrime * sigmaPrime) + 1.0 / v);
        double muPrime = mu + phiPrime * phiPrime * scoreResidual;

        RatingState next = new RatingState(
                RatingState.DEFAULT_RATING + muPrime * SCALE,
                clampRd(phiPrime * SCALE),
                sigmaPrime
        );
        if (!next.isFinite()) {
            throw new RatingConvergenceException("Non-finite rating state after update: " + next);
        }
        return next;
    }

    // ============ MATH HELPERS ============

    static double g(double phi) {
        return 1.0 / Math.sqrt(1.0 + 3.0 * phi * phi / (Math.PI * Math.PI));
    }

    static double expected(double mu, double muJ, double phiJ) {
        return 1.0 / (1.0 + Math.exp(-g(phiJ) * (mu - muJ)));
    }

    private static double toMu(double rating) {
        return (rating - RatingState.DEFAULT_RATING) / SCALE;
    }

    private double clampRd(double rd) {
        return Math.min(maxRd, Math.max(minRd, rd));
    }

    /**
     * One game from a wrestler's point of view: the opponent as they stood at the
     * start of the period, the score (1 win, 0 loss) and the win-type weight.
     */
    record GameResult(RatingState opponent, double score, double weight) {}
}
