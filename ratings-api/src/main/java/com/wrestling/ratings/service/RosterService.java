package com.wrestling.ratings.service;

import com.wrestling.ratings.model.AthleteInfo;
import com.wrestling.ratings.model.MatchResult;
import com.wrestling.ratings.model.Overrides;
import com.wrestling.ratings.model.RecordTally;
import com.wrestling.ratings.model.SectionDivisionData;
import com.wrestling.ratings.model.TeamInfo;
import com.wrestling.ratings.model.readonly.MatchDocument;
import com.wrestling.ratings.model.readonly.TeamDocument;
import com.wrestling.ratings.model.readonly.WrestlerDocument;
import com.wrestling.ratings.repository.readonly.MatchReadRepository;
import com.wrestling.ratings.repository.readonly.TeamReadRepository;
import com.wrestling.ratings.repository.readonly.WrestlerReadRepository;
import com.wrestling.ratings.util.SchoolYear;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Who gets rated and who gets shown.
 *
 * The roster is everyone with enough rated wins plus the wrestlers named in
 * overrides. Eligibility for the leaderboard then drops excluded and
 * graduated wrestlers.
 */
@Service
public class RosterService {

    private static final Logger log = LoggerFactory.getLogger(RosterService.class);

    private final MatchReadRepository matchRepository;
    private final WrestlerReadRepository wrestlerRepository;
    private final TeamReadRepository teamRepository;
    private final Clock clock;

    public RosterService(
            MatchReadRepository matchRepository,
            WrestlerReadRepository wrestlerRepository,
            TeamReadRepository teamRepository,
            Clock clock
    ) {
        this.matchRepository = matchRepository;
        this.wrestlerRepository = wrestlerRepository;
        this.teamRepository = teamRepository;
        this.clock = clock;
    }

    // ============ ROSTER ============

    /**
     * Wrestlers with at least {@code minWins} rated wins across every stored
     * bout, plus override-listed wrestlers that are not excluded. Sorted by id.
     */
    public Set<String> findActiveWrestlers(int minWins, Overrides overrides) {
        Map<String, Integer> wins = new HashMap<>();
        for (MatchDocument doc : matchRepository.findDecided()) {
            String winner = doc.getWinnerId();
            if (winner.equals(doc.getTopId()) || winner.equals(doc.getBottomId())) {
                wins.merge(winner, 1, Integer::sum);
            }
        }

        Set<String> active = new TreeSet<>();
        wins.forEach((wrestlerId, count) -> {
            if (count >= minWins) {
                active.add(wrestlerId);
            }
        });
        int fromWins = active.size();

        for (String wrestlerId : overrides.manuallyListedIds()) {
            if (!overrides.excluded().contains(wrestlerId)) {
                active.add(wrestlerId);
            }
        }

        log.info("Active roster: {} wrestlers with >= {} wins, {} total with overrides",
                fromWins, minWins, active.size());
        return active;
    }

    /**
     * Wins and losses per wrestler. Bouts whose winner is not a participant are skipped.
     */
    public static RecordTally tallyRecords(Collection<MatchResult> matches) {
        Map<String, Integer> wins = new HashMap<>();
        Map<String, Integer> losses = new HashMap<>();
        for (MatchResult match : matches) {
            if (!match.isRated()) {
                continue;
            }
            wins.merge(match.winnerId(), 1, Integer::sum);
            losses.merge(match.loserId(), 1, Integer::sum);
        }
        return new RecordTally(wins, losses);
    }

    // ============ ATHLETES ============

    /**
     * Display metadata for the given wrestlers with grad-year and team
     * overrides applied. Wrestlers missing from the wrestler collection only
     * appear when an override names them.
     */
    public Map<String, AthleteInfo> loadAthletes(Collection<String> wrestlerIds, Overrides overrides) {
        Map<String, AthleteInfo> athletes = new LinkedHashMap<>();
        for (WrestlerDocument doc : wrestlerRepository.findByIdIn(wrestlerIds)) {
            athletes.put(doc.getId(), new AthleteInfo(
                    doc.getId(),
                    doc.getName(),
                    overrides.teams().getOrDefault(doc.getId(), doc.getTeamId()),
                    overrides.gradYears().getOrDefault(doc.getId(), doc.getGradYear())
            ));
        }

        for (String wrestlerId : wrestlerIds) {
            if (athletes.containsKey(wrestlerId)) {
                continue;
            }
            String team = overrides.teams().get(wrestlerId);
            Integer gradYear = overrides.gradYears().get(wrestlerId);
            if (team != null || gradYear != null) {
                athletes.put(wrestlerId, new AthleteInfo(wrestlerId, null, team, gradYear));
            }
        }
        return athletes;
    }

    /**
     * Rated wrestlers that may appear on the leaderboard.
     *
     * With a grad-year filter, only that class, and only while still in
     * school. Without one, everyone not known to have graduated.
     */
    public Set<String> eligibleWrestlers(
            Collection<String> ratedIds,
            Map<String, AthleteInfo> athletes,
            Overrides overrides,
            Integer gradYearFilter
    ) {
        int currentSchoolYear = SchoolYear.of(LocalDate.now(clock));
        Set<String> eligible = new LinkedHashSet<>();

        for (String wrestlerId : ratedIds) {
            if (overrides.excluded().contains(wrestlerId)) {
                continue;
            }
            AthleteInfo info = athletes.get(wrestlerId);
            Integer gradYear = info != null ? info.gradYear() : null;

            if (gradYearFilter != null) {
                if (gradYear != null && gradYear.equals(gradYearFilter) && gradYear > currentSchoolYear) {
                    eligible.add(wrestlerId);
                }
            } else if (gradYear == null || gradYear > currentSchoolYear) {
                eligible.add(wrestlerId);
            }
        }

        log.info("{} of {} rated wrestlers eligible (school year {}, grad year filter {})",
                eligible.size(), ratedIds.size(), currentSchoolYear, gradYearFilter);
        return eligible;
    }

    // ============ TEAMS ============

    /**
     * Team metadata for the override teams and the teams of eligible
     * wrestlers, in that order. The first non-empty value of each field wins.
     */
    public Map<String, TeamInfo> loadTeamMetadata(
            Overrides overrides,
            Map<String, AthleteInfo> athletes,
            Set<String> eligible
    ) {
        Set<String> teamIds = new LinkedHashSet<>(overrides.teams().values());
        for (String wrestlerId : eligible) {
            AthleteInfo info = athletes.get(wrestlerId);
            if (info != null && info.teamId() != null && !info.teamId().isEmpty()) {
                teamIds.add(info.teamId());
            }
        }
        if (teamIds.isEmpty()) {
            return Map.of();
        }

        Map<String, TeamInfo> loaded = new HashMap<>();
        for (TeamDocument doc : teamRepository.findByIdIn(teamIds)) {
            TeamInfo info = new TeamInfo(doc.getName(), doc.getDivision(), doc.getSection());
            loaded.merge(doc.getId(), info, TeamInfo::mergeMissing);
        }

        Map<String, TeamInfo> metadata = new LinkedHashMap<>();
        for (String teamId : teamIds) {
            metadata.put(teamId, loaded.getOrDefault(teamId, TeamInfo.empty()));
        }
        return metadata;
    }

    /**
     * Distinct sections and divisions of the eligible wrestlers' teams.
     */
    public static SectionDivisionData sectionDivisionData(
            Set<String> eligible,
            Map<String, AthleteInfo> athletes,
            Map<String, TeamInfo> teamMetadata
    ) {
        Set<String> sections = new TreeSet<>();
        Set<Integer> divisions = new TreeSet<>();
        for (String wrestlerId : eligible) {
            AthleteInfo info = athletes.get(wrestlerId);
            if (info == null || info.teamId() == null) {
                continue;
            }
            TeamInfo team = teamMetadata.get(info.teamId());
            if (team == null) {
                continue;
            }
            if (team.section() != null && !team.section().isEmpty()) {
                sections.add(team.section());
            }
            if (team.division() != null) {
                divisions.add(team.division());
            }
        }
        return new SectionDivisionData(sections.stream().toList(), divisions.stream().toList());
    }
}
