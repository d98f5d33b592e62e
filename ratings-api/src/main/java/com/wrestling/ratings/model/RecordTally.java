package com.wrestling.ratings.model;

import java.util.Map;

/**
 * Wins and losses per wrestler over a match set.
 */
public record RecordTally(
        Map<String, Integer> wins,
        Map<String, Integer> losses
) {
    public int winsOf(String wrestlerId) {
        return wins.getOrDefault(wrestlerId, 0);
    }

    public int lossesOf(String wrestlerId) {
        return losses.getOrDefault(wrestlerId, 0);
    }
}
