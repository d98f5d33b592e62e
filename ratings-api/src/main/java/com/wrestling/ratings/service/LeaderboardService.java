package com.wrestling.ratings.service;

import com.wrestling.ratings.model.AthleteInfo;
import com.wrestling.ratings.model.HeadToHead;
import com.wrestling.ratings.model.RatingRunResult;
import com.wrestling.ratings.model.RatingState;
import com.wrestling.ratings.model.TeamInfo;
import com.wrestling.ratings.model.TeamRoster;
import com.wrestling.ratings.model.WeightClassUsage;
import com.wrestling.ratings.model.WrestlerEntry;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds per-weight-class rankings and team rosters from a finished rating run.
 */
@Service
public class LeaderboardService {

    static final double RATING_TIE_TOLERANCE = 1e-6;

    /**
     * Rank eligible wrestlers inside each target weight class.
     *
     * A wrestler belongs to the class of their weight override if present,
     * otherwise to their primary (most common recent) weight class. Order is
     * rating descending; ratings within {@value #RATING_TIE_TOLERANCE} of each
     * other are ordered by net head-to-head wins, and remain in run order
     * when that is level too.
     *
     * @param limit maximum entries per class, null for all
     */
    public Leaderboard buildLeaderboard(
            RatingRunResult result,
            List<String> weightClasses,
            Integer limit,
            Map<String, AthleteInfo> athletes,
            Set<String> allowedIds,
            Map<String, String> weightOverrides,
            Map<String, Integer> wins,
            Map<String, Integer> losses
    ) {
        Map<String, List<String>> rankings = new LinkedHashMap<>();
        Map<String, WrestlerEntry> wrestlers = new LinkedHashMap<>();

        for (String weightClass : weightClasses) {
            List<String> candidates = new ArrayList<>();
            for (String wrestlerId : result.ratings().keySet()) {
                if (!allowedIds.contains(wrestlerId)) {
                    continue;
                }
                String primary = primaryWeightClass(result.weightUsage(), wrestlerId, weightOverrides);
                if (weightClass.equals(primary)) {
                    candidates.add(wrestlerId);
                }
            }

            List<String> ranked = rank(candidates, result.ratings(), result.headToHead());
            if (limit != null && ranked.size() > limit) {
                ranked = ranked.subList(0, Math.max(0, limit));
            }

            List<String> ranking = new ArrayList<>();
            for (String wrestlerId : ranked) {
                wrestlers.computeIfAbsent(wrestlerId, id -> toEntry(
                        id, result.rating(id), athletes.get(id), wins, losses));
                ranking.add(wrestlerId);
            }
            rankings.put(weightClass, ranking);
        }

        return new Leaderboard(rankings, wrestlers);
    }

    /**
     * Group ranked wrestlers under their teams.
     *
     * Teams are ordered by name (case-insensitive, unnamed first) then id;
     * inside a team, classes follow {@code weightClasses} and wrestlers keep
     * their ranking order.
     */
    public List<TeamRoster> buildTeamRosters(
            Map<String, List<String>> rankings,
            List<String> weightClasses,
            Map<String, WrestlerEntry> wrestlers,
            Map<String, TeamInfo> teamMetadata
    ) {
        Map<String, TeamInfo> infoByTeam = new LinkedHashMap<>();
        Map<String, Map<String, List<String>>> weightsByTeam = new LinkedHashMap<>();

        for (String weightClass : weightClasses) {
            for (String wrestlerId : rankings.getOrDefault(weightClass, List.of())) {
                WrestlerEntry wrestler = wrestlers.get(wrestlerId);
                if (wrestler == null || wrestler.teamId() == null || wrestler.teamId().isEmpty()) {
                    continue;
                }
                String teamId = wrestler.teamId();
                TeamInfo meta = teamMetadata.getOrDefault(teamId, TeamInfo.empty());
                infoByTeam.merge(teamId, meta, TeamInfo::mergeMissing);
                weightsByTeam.computeIfAbsent(teamId, id -> new LinkedHashMap<>())
                        .computeIfAbsent(weightClass, w -> new ArrayList<>())
                        .add(wrestlerId);
            }
        }

        List<TeamRoster> rosters = new ArrayList<>();
        for (Map.Entry<String, TeamInfo> entry : infoByTeam.entrySet()) {
            TeamInfo info = entry.getValue();
            rosters.add(new TeamRoster(entry.getKey(), info.name(), info.division(), info.section(),
                    weightsByTeam.get(entry.getKey())));
        }
        rosters.sort(Comparator
                .comparing((TeamRoster roster) -> roster.name() == null ? "" : roster.name().toLowerCase(Locale.ROOT))
                .thenComparing(TeamRoster::id));
        return rosters;
    }

    /**
     * Override first, otherwise the mode of the recent weight-class window.
     */
    public static String primaryWeightClass(WeightClassUsage usage, String wrestlerId, Map<String, String> overrides) {
        if (overrides != null && overrides.containsKey(wrestlerId)) {
            return overrides.get(wrestlerId);
        }
        return usage.primaryWeightClass(wrestlerId);
    }

    // ============ RANKING ============

    /**
     * Rating descending, then net head-to-head inside runs of tied ratings.
     * A run holds the ratings within tolerance of its first (highest) member,
     * so head-to-head never reorders across a real rating gap.
     * The tie-break pass is an insertion sort so that a head-to-head cycle
     * (A beat B, B beat C, C beat A) cannot break the sort contract.
     */
    static List<String> rank(List<String> candidates, Map<String, RatingState> ratings, HeadToHead headToHead) {
        List<String> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingDouble((String id) -> ratings.get(id).rating()).reversed());

        int runStart = 0;
        while (runStart < ordered.size()) {
            int runEnd = runStart + 1;
            while (runEnd < ordered.size() && isTied(ratings, ordered.get(runStart), ordered.get(runEnd))) {
                runEnd++;
            }
            if (runEnd - runStart > 1) {
                breakTies(ordered, runStart, runEnd, headToHead);
            }
            runStart = runEnd;
        }
        return ordered;
    }

    private static boolean isTied(Map<String, RatingState> ratings, String a, String b) {
        return Math.abs(ratings.get(a).rating() - ratings.get(b).rating()) <= RATING_TIE_TOLERANCE;
    }

    private static void breakTies(List<String> ordered, int from, int to, HeadToHead headToHead) {
        for (int i = from + 1; i < to; i++) {
            String current = ordered.get(i);
            int j = i - 1;
            while (j >= from && headToHead.net(current, ordered.get(j)) > 0) {
                ordered.set(j + 1, ordered.get(j));
                j--;
            }
            ordered.set(j + 1, current);
        }
    }

    private static WrestlerEntry toEntry(
            String wrestlerId,
            RatingState state,
            AthleteInfo info,
            Map<String, Integer> wins,
            Map<String, Integer> losses
    ) {
        String name = info != null && info.name() != null ? info.name() : wrestlerId;
        return new WrestlerEntry(
                wrestlerId,
                name,
                info != null ? info.teamId() : null,
                info != null ? info.gradYear() : null,
                round(state.rating(), 2),
                round(state.rd(), 2),
                round(state.sigma(), 4),
                wins.getOrDefault(wrestlerId, 0),
                losses.getOrDefault(wrestlerId, 0)
        );
    }

    static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    // ============ RESULT RECORDS ============

    public record Leaderboard(
            Map<String, List<String>> rankings,
            Map<String, WrestlerEntry> wrestlers
    ) {}
}
