package com.wrestling.ratings.service;

import com.wrestling.ratings.model.AthleteInfo;
import com.wrestling.ratings.model.HeadToHead;
import com.wrestling.ratings.model.RatingRunResult;
import com.wrestling.ratings.model.RatingState;
import com.wrestling.ratings.model.TeamInfo;
import com.wrestling.ratings.model.TeamRoster;
import com.wrestling.ratings.model.WeightClassUsage;
import com.wrestling.ratings.model.WrestlerEntry;
import com.wrestling.ratings.service.LeaderboardService.Leaderboard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LeaderboardServiceTest {

    private static final List<String> WEIGHTS = List.of("126", "132", "138");

    LeaderboardService service;
    Map<String, RatingState> ratings;
    HeadToHead headToHead;
    WeightClassUsage usage;

    @BeforeEach
    void setUp() {
        service = new LeaderboardService();
        ratings = new LinkedHashMap<>();
        headToHead = new HeadToHead();
        usage = new WeightClassUsage();
    }

    private void rated(String id, double rating, String weightClass) {
        ratings.put(id, new RatingState(rating, 80.0, 0.06));
        usage.record(id, weightClass);
    }

    private Leaderboard build(Integer limit, Set<String> allowed, Map<String, String> overrides) {
        return service.buildLeaderboard(
                new RatingRunResult(ratings, headToHead, usage, List.of()),
                WEIGHTS, limit, Map.of(), allowed, overrides, Map.of(), Map.of());
    }

    // =========================================================================
    // Rankings
    // =========================================================================

    @Nested
    @DisplayName("Rankings")
    class Rankings {

        @Test
        @DisplayName("each class is ordered by rating, highest first")
        void orderedByRating() {
            rated("low", 1450, "132");
            rated("high", 1710, "132");
            rated("mid", 1580, "132");

            Leaderboard board = build(null, Set.of("low", "high", "mid"), Map.of());

            assertEquals(List.of("high", "mid", "low"), board.rankings().get("132"));
            assertEquals(List.of(), board.rankings().get("126"));
            assertEquals(WEIGHTS, List.copyOf(board.rankings().keySet()));
        }

        @Test
        @DisplayName("equal ratings are ordered by net head-to-head regardless of input order")
        void headToHeadTieBreak() {
            rated("a", 1600, "132");
            rated("b", 1600, "132");
            headToHead.recordWin("b", "a");

            assertEquals(List.of("b", "a"), build(null, Set.of("a", "b"), Map.of()).rankings().get("132"));

            ratings.clear();
            rated("b", 1600, "132");
            rated("a", 1600, "132");
            assertEquals(List.of("b", "a"), build(null, Set.of("a", "b"), Map.of()).rankings().get("132"));
        }

        @Test
        @DisplayName("ratings within 1e-6 count as tied")
        void nearlyEqualRatingsAreTied() {
            rated("a", 1600.0000005, "132");
            rated("b", 1600.0, "132");
            headToHead.recordWin("b", "a");

            assertEquals(List.of("b", "a"), build(null, Set.of("a", "b"), Map.of()).rankings().get("132"));
        }

        @Test
        @DisplayName("a head-to-head cycle does not break the sort")
        void headToHeadCycle() {
            rated("a", 1600, "132");
            rated("b", 1600, "132");
            rated("c", 1600, "132");
            headToHead.recordWin("a", "b");
            headToHead.recordWin("b", "c");
            headToHead.recordWin("c", "a");

            List<String> ranking = build(null, Set.of("a", "b", "c"), Map.of()).rankings().get("132");

            assertEquals(Set.of("a", "b", "c"), Set.copyOf(ranking));
        }

        @Test
        @DisplayName("a real rating gap is never overturned by head-to-head")
        void ratingBeatsHeadToHead() {
            rated("a", 1650, "132");
            rated("b", 1600, "132");
            headToHead.recordWin("b", "a");
            headToHead.recordWin("b", "a");

            assertEquals(List.of("a", "b"), build(null, Set.of("a", "b"), Map.of()).rankings().get("132"));
        }

        @Test
        @DisplayName("a chain of near ties does not let head-to-head jump a real gap")
        void chainedNearTies() {
            rated("a", 1600.0000012, "132");
            rated("b", 1600.0000006, "132");
            rated("c", 1600.0, "132");
            headToHead.recordWin("c", "a");
            headToHead.recordWin("c", "b");

            assertEquals(List.of("a", "b", "c"), build(null, Set.of("a", "b", "c"), Map.of()).rankings().get("132"));
        }

        @Test
        @DisplayName("limit caps each class")
        void limit() {
            rated("a", 1700, "132");
            rated("b", 1650, "132");
            rated("c", 1600, "132");

            Leaderboard board = build(2, Set.of("a", "b", "c"), Map.of());

            assertEquals(List.of("a", "b"), board.rankings().get("132"));
            assertFalse(board.wrestlers().containsKey("c"));
        }

        @Test
        @DisplayName("only allowed wrestlers are ranked")
        void allowedOnly() {
            rated("a", 1700, "132");
            rated("graduated", 1800, "132");

            Leaderboard board = build(null, Set.of("a"), Map.of());

            assertEquals(List.of("a"), board.rankings().get("132"));
        }

        @Test
        @DisplayName("a weight override moves a wrestler to that class")
        void weightOverride() {
            rated("a", 1700, "132");
            rated("b", 1650, "132");

            Leaderboard board = build(null, Set.of("a", "b"), Map.of("a", "138"));

            assertEquals(List.of("b"), board.rankings().get("132"));
            assertEquals(List.of("a"), board.rankings().get("138"));
        }

        @Test
        @DisplayName("wrestlers whose class is not targeted are left out")
        void untargetedClass() {
            rated("heavy", 1700, "285");

            Leaderboard board = build(null, Set.of("heavy"), Map.of());

            assertTrue(board.wrestlers().isEmpty());
        }
    }

    // =========================================================================
    // Entries
    // =========================================================================

    @Nested
    @DisplayName("Entries")
    class Entries {

        @Test
        @DisplayName("entries carry rounded state, metadata and record")
        void entryFields() {
            ratings.put("a", new RatingState(1523.456789, 64.005, 0.0612345));
            usage.record("a", "132");
            Map<String, AthleteInfo> athletes = Map.of("a", new AthleteInfo("a", "Alex Smith", "t1", 2026));

            Leaderboard board = service.buildLeaderboard(
                    new RatingRunResult(ratings, headToHead, usage, List.of()),
                    WEIGHTS, null, athletes, Set.of("a"), Map.of(), Map.of("a", 7), Map.of("a", 2));

            WrestlerEntry entry = board.wrestlers().get("a");
            assertEquals("Alex Smith", entry.name());
            assertEquals("t1", entry.teamId());
            assertEquals(2026, entry.gradYear());
            assertEquals(1523.46, entry.rating());
            assertEquals(64.01, entry.rd());
            assertEquals(0.0612, entry.sigma());
            assertEquals(7, entry.wins());
            assertEquals(2, entry.losses());
        }

        @Test
        @DisplayName("name falls back to the id when metadata is missing")
        void nameFallback() {
            rated("w-99", 1500, "132");

            WrestlerEntry entry = build(null, Set.of("w-99"), Map.of()).wrestlers().get("w-99");

            assertEquals("w-99", entry.name());
            assertNull(entry.teamId());
            assertEquals(0, entry.wins());
        }

        @Test
        @DisplayName("rounding is half-up")
        void halfUp() {
            assertEquals(2.35, LeaderboardService.round(2.345, 2));
            assertEquals(0.0613, LeaderboardService.round(0.06125, 4));
        }

        @Test
        @DisplayName("primary weight class prefers the override")
        void primaryWeightClass() {
            usage.record("a", "132");

            assertEquals("132", LeaderboardService.primaryWeightClass(usage, "a", Map.of()));
            assertEquals("138", LeaderboardService.primaryWeightClass(usage, "a", Map.of("a", "138")));
            assertNull(LeaderboardService.primaryWeightClass(usage, "nobody", Map.of()));
        }
    }

    // =========================================================================
    // Team rosters
    // =========================================================================

    @Nested
    @DisplayName("Team rosters")
    class TeamRosters {

        @Test
        @DisplayName("wrestlers are grouped by team, teams sorted by name then id")
        void groupsByTeam() {
            Map<String, WrestlerEntry> wrestlers = Map.of(
                    "a", entry("a", "t2"),
                    "b", entry("b", "t1"),
                    "c", entry("c", "t2"),
                    "d", entry("d", null));
            Map<String, List<String>> rankings = new LinkedHashMap<>();
            rankings.put("126", List.of("c"));
            rankings.put("132", List.of("a", "b", "d"));
            Map<String, TeamInfo> meta = Map.of(
                    "t1", new TeamInfo("zephyr high", 2, "Central"),
                    "t2", new TeamInfo("Alpine", 1, "North"));

            List<TeamRoster> rosters = service.buildTeamRosters(rankings, List.of("126", "132", "138"), wrestlers, meta);

            assertEquals(List.of("t2", "t1"), rosters.stream().map(TeamRoster::id).toList());
            TeamRoster alpine = rosters.get(0);
            assertEquals("Alpine", alpine.name());
            assertEquals(1, alpine.division());
            assertEquals("North", alpine.section());
            assertEquals(List.of("126", "132"), List.copyOf(alpine.weights().keySet()));
            assertEquals(List.of("a"), alpine.weights().get("132"));
        }

        @Test
        @DisplayName("teams without metadata sort first and keep null fields")
        void missingMetadata() {
            Map<String, WrestlerEntry> wrestlers = Map.of("a", entry("a", "t9"), "b", entry("b", "t1"));

            List<TeamRoster> rosters = service.buildTeamRosters(
                    Map.of("132", List.of("a", "b")), List.of("132"), wrestlers,
                    Map.of("t1", new TeamInfo("Bravo", null, null)));

            assertEquals("t9", rosters.get(0).id());
            assertNull(rosters.get(0).name());
        }

        private WrestlerEntry entry(String id, String teamId) {
            return new WrestlerEntry(id, id, teamId, null, 1500, 80, 0.06, 0, 0);
        }
    }
}
