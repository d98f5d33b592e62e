package com.wrestling.ratings.service;

import com.wrestling.ratings.model.HeadToHead;
import com.wrestling.ratings.model.MatchResult;
import com.wrestling.ratings.model.Prediction;
import com.wrestling.ratings.model.RatingState;
import com.wrestling.ratings.model.WeightClassUsage;
import com.wrestling.ratings.model.WinType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.wrestling.ratings.fixtures.TestFixtures.match;
import static org.junit.jupiter.api.Assertions.*;

class Glicko2EngineTest {

    private static final double EPS = 1e-9;

    private Glicko2Engine engine;
    private HeadToHead headToHead;
    private WeightClassUsage weightUsage;

    @BeforeEach
    void setUp() {
        engine = new Glicko2Engine(0.5);
        headToHead = new HeadToHead();
        weightUsage = new WeightClassUsage();
    }

    // =========================================================================
    // State
    // =========================================================================

    @Nested
    @DisplayName("State")
    class State {

        @Test
        @DisplayName("new wrestlers start at 1500 / 350 / 0.06")
        void defaults() {
            engine.ensurePlayer("a");

            assertEquals(RatingState.initial(), engine.getState("a"));
        }

        @Test
        @DisplayName("ensurePlayer never resets an existing wrestler")
        void ensurePlayerIsIdempotent() {
            engine.processPeriod(List.of(match("2023-01-05", "a", "b")), headToHead, weightUsage);
            RatingState afterMatch = engine.getState("a");

            engine.ensurePlayer("a");

            assertEquals(afterMatch, engine.getState("a"));
        }

        @Test
        @DisplayName("invalid tau is rejected")
        void invalidTau() {
            assertThrows(IllegalArgumentException.class, () -> new Glicko2Engine(0.0));
            assertThrows(IllegalArgumentException.class, () -> new Glicko2Engine(Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> new Glicko2Engine(1e-300));
        }
    }

    // =========================================================================
    // Win probability
    // =========================================================================

    @Nested
    @DisplayName("Win probability")
    class WinProbability {

        @Test
        @DisplayName("equal states give 0.5")
        void equalStates() {
            assertEquals(0.5, engine.winProbability(RatingState.initial(), RatingState.initial()), EPS);
        }

        @Test
        @DisplayName("P(a,b) + P(b,a) = 1 for equal RDs")
        void symmetric() {
            RatingState a = new RatingState(1620, 120, 0.06);
            RatingState b = new RatingState(1480, 120, 0.06);

            assertEquals(1.0, engine.winProbability(a, b) + engine.winProbability(b, a), EPS);
        }

        @Test
        @DisplayName("higher rating means higher probability")
        void monotonicInRating() {
            RatingState opponent = new RatingState(1500, 80, 0.06);
            double lower = engine.winProbability(new RatingState(1550, 80, 0.06), opponent);
            double higher = engine.winProbability(new RatingState(1650, 80, 0.06), opponent);

            assertTrue(higher > lower);
            assertTrue(lower > 0.5);
        }

        @Test
        @DisplayName("unknown wrestlers are treated as defaults")
        void unknownIds() {
            assertEquals(0.5, engine.winProbability("x", "y"), EPS);
            assertTrue(engine.getStates().isEmpty());
        }
    }

    // =========================================================================
    // Period update
    // =========================================================================

    @Nested
    @DisplayName("Period update")
    class PeriodUpdate {

        @Test
        @DisplayName("a fall between two new wrestlers moves both ratings symmetrically")
        void fallBetweenNewWrestlers() {
            List<Prediction> predictions = engine.processPeriod(
                    List.of(match("2023-01-05", "a", "b")), headToHead, weightUsage);

            RatingState a = engine.getState("a");
            RatingState b = engine.getState("b");
            assertEquals(1, predictions.size());
            assertEquals(0.5, predictions.get(0).probability(), EPS);
            assertEquals(1.0, predictions.get(0).actual(), EPS);
            assertTrue(a.rating() > 1500);
            assertTrue(b.rating() < 1500);
            assertEquals(a.rating() - 1500, 1500 - b.rating(), 1e-6);
            assertTrue(a.rd() < 350);
            assertEquals(1, headToHead.wins("a", "b"));
            assertEquals(0, headToHead.wins("b", "a"));
            assertEquals("132", weightUsage.primaryWeightClass("a"));
        }

        @Test
        @DisplayName("a fall moves ratings more than a decision")
        void winTypeWeighting() {
            Glicko2Engine other = new Glicko2Engine(0.5);
            engine.processPeriod(List.of(match("2023-01-05", "a", "b", "F", "132")), headToHead, weightUsage);
            other.processPeriod(List.of(match("2023-01-05", "a", "b", "DEC", "132")), new HeadToHead(), new WeightClassUsage());

            assertTrue(engine.getState("a").rating() > other.getState("a").rating());
        }

        @Test
        @DisplayName("beating a stronger opponent gains more than beating a weaker one")
        void gainGrowsWithOpponentRating() {
            RatingState player = new RatingState(1500, 100, 0.06);
            double weight = WinType.DECISION.weight();

            RatingState afterStrong = engine.updatePlayer(player,
                    List.of(new Glicko2Engine.GameResult(new RatingState(1700, 100, 0.06), 1.0, weight)));
            RatingState afterWeak = engine.updatePlayer(player,
                    List.of(new Glicko2Engine.GameResult(new RatingState(1300, 100, 0.06), 1.0, weight)));

            assertTrue(afterWeak.rating() > 1500);
            assertTrue(afterStrong.rating() - 1500 > afterWeak.rating() - 1500,
                    "strong=" + afterStrong.rating() + " weak=" + afterWeak.rating());
        }

        @Test
        @DisplayName("an empty period only grows RD")
        void emptyPeriod() {
            engine.processPeriod(List.of(match("2023-01-05", "a", "b")), headToHead, weightUsage);
            RatingState before = engine.getState("a");

            List<Prediction> predictions = engine.processPeriod(List.of(), headToHead, weightUsage);

            RatingState after = engine.getState("a");
            assertTrue(predictions.isEmpty());
            assertEquals(before.rating(), after.rating(), EPS);
            assertEquals(before.sigma(), after.sigma(), EPS);
            assertTrue(after.rd() > before.rd());
        }

        @Test
        @DisplayName("matches with an invalid winner have no effect")
        void invalidWinnerIgnored() {
            MatchResult noWinner = new MatchResult("m1", LocalDate.parse("2023-01-05"), "a", "b", null, "F", "132");
            MatchResult strangerWins = new MatchResult("m2", LocalDate.parse("2023-01-05"), "a", "b", "z", "F", "132");

            List<Prediction> predictions = engine.processPeriod(List.of(noWinner, strangerWins), headToHead, weightUsage);

            assertTrue(predictions.isEmpty());
            assertTrue(engine.getStates().isEmpty());
            assertEquals(0, headToHead.size());
        }

        @Test
        @DisplayName("order of matches inside a period does not change the outcome")
        void simultaneousUpdate() {
            List<MatchResult> matches = List.of(
                    match("2023-01-05", "a", "b"),
                    match("2023-01-06", "b", "c"),
                    match("2023-01-07", "c", "a", "DEC", "132"));
            List<MatchResult> reversed = new ArrayList<>(matches);
            Collections.reverse(reversed);

            Glicko2Engine other = new Glicko2Engine(0.5);
            engine.processPeriod(matches, headToHead, weightUsage);
            other.processPeriod(reversed, new HeadToHead(), new WeightClassUsage());

            for (String id : List.of("a", "b", "c")) {
                assertEquals(engine.getState(id).rating(), other.getState(id).rating(), 1e-9);
                assertEquals(engine.getState(id).rd(), other.getState(id).rd(), 1e-9);
            }
        }

        @Test
        @DisplayName("RD stays inside [30, 350] after many periods")
        void rdBounds() {
            for (int period = 0; period < 40; period++) {
                List<MatchResult> matches = new ArrayList<>();
                for (int i = 0; i < 6; i++) {
                    matches.add(i % 2 == 0 ? match("2023-01-05", "a", "b") : match("2023-01-05", "b", "a"));
                }
                engine.processPeriod(matches, headToHead, weightUsage);
            }

            for (RatingState state : engine.getStates().values()) {
                assertTrue(state.rd() >= 30 && state.rd() <= 350, "RD out of bounds: " + state.rd());
                assertTrue(state.isFinite());
            }
        }
    }

    // =========================================================================
    // Uncertainty growth
    // =========================================================================

    @Nested
    @DisplayName("Uncertainty growth")
    class UncertaintyGrowth {

        @Test
        @DisplayName("a six month gap inflates RD by sqrt(phi^2 + 6 sigma^2)")
        void sixMonthGap() {
            playManyPeriods();
            RatingState before = engine.getState("a");

            engine.inflateForGap(6.0);

            double phi = before.rd() / Glicko2Engine.SCALE;
            double expected = Math.sqrt(phi * phi + 6.0 * before.sigma() * before.sigma()) * Glicko2Engine.SCALE;
            assertEquals(Math.min(350, expected), engine.getState("a").rd(), 1e-9);
            assertEquals(before.rating(), engine.getState("a").rating(), EPS);
        }

        @Test
        @DisplayName("no gap, no change")
        void zeroGap() {
            playManyPeriods();
            RatingState before = engine.getState("a");

            engine.inflateForGap(0.0);

            assertEquals(before, engine.getState("a"));
        }

        @Test
        @DisplayName("season reset raises low RDs to the floor and leaves high ones")
        void seasonReset() {
            playManyPeriods();
            engine.ensurePlayer("fresh");
            assertTrue(engine.getState("a").rd() < Glicko2Engine.DEFAULT_SEASON_RD_FLOOR);

            engine.resetRdForSeason();

            assertEquals(Glicko2Engine.DEFAULT_SEASON_RD_FLOOR, engine.getState("a").rd(), EPS);
            assertEquals(350.0, engine.getState("fresh").rd(), EPS);
        }

        private void playManyPeriods() {
            for (int period = 0; period < 12; period++) {
                List<MatchResult> matches = new ArrayList<>();
                for (int i = 0; i < 5; i++) {
                    matches.add(i % 2 == 0 ? match("2023-01-05", "a", "b") : match("2023-01-05", "b", "a"));
                }
                engine.processPeriod(matches, headToHead, weightUsage);
            }
        }
    }
}
