package com.wrestling.ratings.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The published leaderboard: rankings per weight class, the wrestlers they
 * reference, team rosters and the run parameters.
 */
public record LeaderboardPayload(
        double tau,
        int matches,
        int periods,
        Integer gradYear,
        AppliedOverrides overrides,
        SectionDivisionData sectionDivisionData,
        List<TeamRoster> teams,
        Map<String, List<String>> weights,
        List<WrestlerEntry> wrestlers
) {

    /**
     * Overrides echoed back to consumers. Empty groups are null.
     */
    public record AppliedOverrides(
            Map<String, String> weights,
            List<String> exclude,
            Map<String, Integer> gradYears,
            Map<String, String> teams
    ) {
        public static AppliedOverrides from(Overrides overrides) {
            List<String> excluded = new ArrayList<>(overrides.excluded());
            excluded.sort(null);
            return new AppliedOverrides(
                    overrides.weights().isEmpty() ? null : overrides.weights(),
                    excluded.isEmpty() ? null : excluded,
                    overrides.gradYears().isEmpty() ? null : overrides.gradYears(),
                    overrides.teams().isEmpty() ? null : overrides.teams()
            );
        }
    }
}
