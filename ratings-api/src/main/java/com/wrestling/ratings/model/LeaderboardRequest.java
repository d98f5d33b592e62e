package com.wrestling.ratings.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Parameters of a leaderboard run. Every field is optional.
 *
 * @param seasons         season names to include, all when empty
 * @param startDate       earliest match date, inclusive
 * @param endDate         latest match date, inclusive
 * @param weights         target weight classes, or a single "all"
 * @param limit           wrestlers per weight class, all when null
 * @param minWins         rated wins needed to enter the roster
 * @param tau             explicit tau; tuned from the candidates when null
 * @param tauCandidates   tau values to back-test
 * @param gradYear        keep only this graduating class
 * @param overridesPath   overrides JSON file
 * @param jsonOutputPath  file the payload is written to
 * @param save            store the result in the leaderboards collection (default true)
 */
public record LeaderboardRequest(
        List<String> seasons,
        LocalDate startDate,
        LocalDate endDate,
        List<String> weights,
        Integer limit,
        Integer minWins,
        Double tau,
        List<Double> tauCandidates,
        Integer gradYear,
        String overridesPath,
        String jsonOutputPath,
        Boolean save
) {
    public static LeaderboardRequest defaults() {
        return new LeaderboardRequest(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean shouldSave() {
        return save == null || save;
    }
}
