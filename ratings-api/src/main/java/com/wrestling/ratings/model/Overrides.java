package com.wrestling.ratings.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Manual per-wrestler corrections applied on top of the scraped data.
 */
public record Overrides(
        Map<String, String> weights,
        Set<String> excluded,
        Map<String, Integer> gradYears,
        Map<String, String> teams
) {
    public static Overrides empty() {
        return new Overrides(Map.of(), Set.of(), Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return weights.isEmpty() && excluded.isEmpty() && gradYears.isEmpty() && teams.isEmpty();
    }

    /**
     * Wrestlers named by a weight, grad-year or team override.
     */
    public Set<String> manuallyListedIds() {
        Set<String> ids = new HashSet<>(weights.keySet());
        ids.addAll(gradYears.keySet());
        ids.addAll(teams.keySet());
        return ids;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> weights = new LinkedHashMap<>();
        private final Set<String> excluded = new HashSet<>();
        private final Map<String, Integer> gradYears = new LinkedHashMap<>();
        private final Map<String, String> teams = new LinkedHashMap<>();

        public Builder weight(String wrestlerId, String weightClass) { weights.put(wrestlerId, weightClass); return this; }
        public Builder exclude(String wrestlerId) { excluded.add(wrestlerId); return this; }
        public Builder gradYear(String wrestlerId, int gradYear) { gradYears.put(wrestlerId, gradYear); return this; }
        public Builder team(String wrestlerId, String teamId) { teams.put(wrestlerId, teamId); return this; }

        public Overrides build() {
            return new Overrides(Map.copyOf(weights), Set.copyOf(excluded), Map.copyOf(gradYears), Map.copyOf(teams));
        }
    }
}
