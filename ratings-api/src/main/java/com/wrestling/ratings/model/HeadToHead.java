package com.wrestling.ratings.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cumulative head-to-head win tally keyed by (winner, loser).
 * Counts only ever grow; the tally is used for leaderboard tie-breaks, never
 * for rating math.
 */
public class HeadToHead {

    private final Map<Pairing, Integer> wins = new LinkedHashMap<>();

    public void recordWin(String winnerId, String loserId) {
        wins.merge(new Pairing(winnerId, loserId), 1, Integer::sum);
    }

    public int wins(String winnerId, String loserId) {
        return wins.getOrDefault(new Pairing(winnerId, loserId), 0);
    }

    /**
     * Wins of {@code a} over {@code b} minus wins of {@code b} over {@code a}.
     */
    public int net(String a, String b) {
        return wins(a, b) - wins(b, a);
    }

    public int size() {
        return wins.size();
    }

    private record Pairing(String winnerId, String loserId) {}
}
