package com.wrestling.ratings.model;

/**
 * Outcome of a leaderboard run. Runs that find nothing to rate are not
 * errors; they carry a status and a message and no payload.
 */
public record LeaderboardRunResult(
        Status status,
        String message,
        Double brier,
        Double accuracy,
        String documentId,
        LeaderboardPayload payload
) {

    public enum Status {
        COMPLETED,
        NO_PERIODS,
        NO_ACTIVE_WRESTLERS,
        NO_MATCHES,
        NO_ELIGIBLE_WRESTLERS
    }

    public static LeaderboardRunResult empty(Status status, String message) {
        return new LeaderboardRunResult(status, message, null, null, null, null);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
