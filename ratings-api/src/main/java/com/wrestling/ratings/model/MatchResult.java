package com.wrestling.ratings.model;

import java.time.LocalDate;

/**
 * A single bout as consumed by the rating engine.
 *
 * The winner may be null (no result recorded) or may not match either
 * participant (bad upstream data). Such matches stay visible to callers but
 * have no rating effect.
 */
public record MatchResult(
        String id,
        LocalDate date,
        String topId,
        String bottomId,
        String winnerId,
        String winType,
        String weightClass
) {

    /**
     * True when the winner is one of the two participants.
     */
    public boolean isRated() {
        if (winnerId == null || topId == null || bottomId == null) {
            return false;
        }
        return winnerId.equals(topId) || winnerId.equals(bottomId);
    }

    public boolean topWon() {
        return topId != null && topId.equals(winnerId);
    }

    /**
     * Loser of a rated match, null otherwise.
     */
    public String loserId() {
        if (!isRated()) return null;
        return topWon() ? bottomId : topId;
    }
}
