package com.wrestling.ratings.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wrestling.ratings.config.RatingsProperties;
import com.wrestling.ratings.model.AthleteInfo;
import com.wrestling.ratings.model.LeaderboardDocument;
import com.wrestling.ratings.model.LeaderboardPayload;
import com.wrestling.ratings.model.LeaderboardRequest;
import com.wrestling.ratings.model.LeaderboardRunResult;
import com.wrestling.ratings.model.LeaderboardRunResult.Status;
import com.wrestling.ratings.model.MatchResult;
import com.wrestling.ratings.model.Overrides;
import com.wrestling.ratings.model.RatingPeriod;
import com.wrestling.ratings.model.RatingRunResult;
import com.wrestling.ratings.model.RecordTally;
import com.wrestling.ratings.model.SectionDivisionData;
import com.wrestling.ratings.model.TeamInfo;
import com.wrestling.ratings.model.TeamRoster;
import com.wrestling.ratings.model.WrestlerEntry;
import com.wrestling.ratings.repository.LeaderboardRepository;
import com.wrestling.ratings.service.LeaderboardService.Leaderboard;
import com.wrestling.ratings.service.TauCalibrationService.TauSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the whole leaderboard pipeline:
 * periods, roster, matches, tau, final ratings, eligibility, rankings, teams.
 */
@Service
public class LeaderboardRunService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardRunService.class);

    static final String ALL_WEIGHTS = "all";

    private final RatingPeriodService periodService;
    private final RosterService rosterService;
    private final MatchFeedService matchFeedService;
    private final RatingSimulationService simulationService;
    private final TauCalibrationService calibrationService;
    private final LeaderboardService leaderboardService;
    private final OverridesLoader overridesLoader;
    private final LeaderboardRepository leaderboardRepository;
    private final RatingsProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LeaderboardRunService(
            RatingPeriodService periodService,
            RosterService rosterService,
            MatchFeedService matchFeedService,
            RatingSimulationService simulationService,
            TauCalibrationService calibrationService,
            LeaderboardService leaderboardService,
            OverridesLoader overridesLoader,
            LeaderboardRepository leaderboardRepository,
            RatingsProperties properties,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.periodService = periodService;
        this.rosterService = rosterService;
        this.matchFeedService = matchFeedService;
        this.simulationService = simulationService;
        this.calibrationService = calibrationService;
        this.leaderboardService = leaderboardService;
        this.overridesLoader = overridesLoader;
        this.leaderboardRepository = leaderboardRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ============ FULL RUN ============

    public LeaderboardRunResult run(LeaderboardRequest request) {
        PreparedRun prepared = prepare(request);
        if (prepared.status() != null) {
            log.info("Leaderboard run stopped: {}", prepared.message());
            return LeaderboardRunResult.empty(prepared.status(), prepared.message());
        }

        double tau;
        Double brier = null;
        Double accuracy = null;
        if (request.tau() != null) {
            tau = request.tau();
            log.info("Using provided tau={}", String.format("%.3f", tau));
        } else {
            TauSelection selection = calibrationService.tuneTau(
                    prepared.periods(), prepared.buckets(), prepared.roster(), tauCandidates(request));
            tau = selection.tau();
            brier = selection.brier();
            accuracy = selection.accuracy();
        }

        RatingRunResult result = simulationService.runSimulation(
                prepared.periods(), prepared.buckets(), prepared.roster(), tau);

        Overrides overrides = prepared.overrides();
        Map<String, AthleteInfo> athletes = rosterService.loadAthletes(result.ratings().keySet(), overrides);
        Set<String> eligible = rosterService.eligibleWrestlers(
                result.ratings().keySet(), athletes, overrides, request.gradYear());
        if (eligible.isEmpty()) {
            String message = "All wrestlers filtered out by graduation year; no leaderboard to display";
            log.info("Leaderboard run stopped: {}", message);
            return LeaderboardRunResult.empty(Status.NO_ELIGIBLE_WRESTLERS, message);
        }

        Map<String, TeamInfo> teamMetadata = rosterService.loadTeamMetadata(overrides, athletes, eligible);
        SectionDivisionData sectionDivisionData = RosterService.sectionDivisionData(eligible, athletes, teamMetadata);

        RecordTally tally = prepared.tally();
        Leaderboard leaderboard = leaderboardService.buildLeaderboard(
                result,
                prepared.weightClasses(),
                request.limit(),
                athletes,
                eligible,
                overrides.weights(),
                tally.wins(),
                tally.losses()
        );
        List<TeamRoster> teams = leaderboardService.buildTeamRosters(
                leaderboard.rankings(), prepared.weightClasses(), leaderboard.wrestlers(), teamMetadata);

        List<WrestlerEntry> wrestlers = new ArrayList<>(leaderboard.wrestlers().values());
        wrestlers.sort(Comparator.comparingDouble(WrestlerEntry::rating).reversed()
                .thenComparing(WrestlerEntry::name)
                .thenComparing(WrestlerEntry::id));

        LeaderboardPayload payload = new LeaderboardPayload(
                tau,
                prepared.matches().size(),
                prepared.periods().size(),
                request.gradYear(),
                LeaderboardPayload.AppliedOverrides.from(overrides),
                sectionDivisionData,
                teams,
                leaderboard.rankings(),
                wrestlers
        );

        String documentId = null;
        if (request.shouldSave()) {
            LeaderboardDocument saved = leaderboardRepository.save(
                    new LeaderboardDocument(Instant.now(clock), payload, brier, accuracy));
            documentId = saved.getId();
            log.info("Saved leaderboard {}", documentId);
        }

        String outputPath = request.jsonOutputPath() != null ? request.jsonOutputPath() : properties.getJsonOutputPath();
        if (outputPath != null && !outputPath.isBlank()) {
            writeJson(Path.of(outputPath), payload);
        }

        String message = String.format("Processed %d matches across %d monthly periods (tau=%.3f)",
                prepared.matches().size(), prepared.periods().size(), tau);
        log.info(message);
        return new LeaderboardRunResult(Status.COMPLETED, message, brier, accuracy, documentId, payload);
    }

    // ============ PARTIAL RUNS ============

    /**
     * Back-test only: same inputs as a full run, returns the tau scores.
     */
    public TauSelection tuneTau(LeaderboardRequest request) {
        PreparedRun prepared = prepare(request);
        if (prepared.status() != null) {
            throw new IllegalArgumentException(prepared.message());
        }
        return calibrationService.tuneTau(
                prepared.periods(), prepared.buckets(), prepared.roster(), tauCandidates(request));
    }

    public List<RatingPeriod> previewPeriods(List<String> seasons, LocalDate startDate, LocalDate endDate) {
        return periodService.buildPeriods(seasonFilter(seasons), startDate, exclusiveEnd(endDate));
    }

    public Optional<LeaderboardDocument> latest() {
        return leaderboardRepository.findFirstByOrderByGeneratedAtDesc();
    }

    // ============ HELPERS ============

    private PreparedRun prepare(LeaderboardRequest request) {
        if (request.tau() != null) {
            VolatilitySolver.requireValidTau(request.tau());
        }
        if (request.limit() != null && request.limit() < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + request.limit());
        }

        List<RatingPeriod> periods = previewPeriods(request.seasons(), request.startDate(), request.endDate());
        if (periods.isEmpty()) {
            return PreparedRun.stopped(Status.NO_PERIODS, "No rating periods to process with the provided filters");
        }

        Overrides overrides = overridesLoader.load(overridesPath(request));
        int minWins = request.minWins() != null ? request.minWins() : properties.getMinWins();
        Set<String> roster = rosterService.findActiveWrestlers(minWins, overrides);
        if (roster.isEmpty()) {
            return PreparedRun.stopped(Status.NO_ACTIVE_WRESTLERS, "No active wrestlers found; try lowering minWins");
        }

        List<String> weightClasses = targetWeightClasses(request.weights());
        Set<String> weightFilter = weightFilter(request.weights());

        List<MatchResult> matches = matchFeedService.loadMatches(
                periods.get(0).start(), periods.get(periods.size() - 1).end(), roster, weightFilter);
        if (matches.isEmpty()) {
            return PreparedRun.stopped(Status.NO_MATCHES, "No matches found for the selected filters");
        }

        RecordTally tally = RosterService.tallyRecords(matches);
        List<List<MatchResult>> buckets = MatchBucketer.bucket(periods, matches);
        return new PreparedRun(null, null, periods, overrides, roster, weightClasses, matches, tally, buckets);
    }

    private List<Double> tauCandidates(LeaderboardRequest request) {
        if (request.tauCandidates() != null && !request.tauCandidates().isEmpty()) {
            return request.tauCandidates();
        }
        return properties.getTauCandidates();
    }

    private Path overridesPath(LeaderboardRequest request) {
        String path = request.overridesPath() != null ? request.overridesPath() : properties.getOverridesPath();
        return path == null || path.isBlank() ? null : Path.of(path);
    }

    List<String> targetWeightClasses(List<String> requested) {
        if (requested == null || requested.isEmpty() || isAll(requested)) {
            return properties.getWeightClasses();
        }
        return requested;
    }

    static Set<String> weightFilter(List<String> requested) {
        if (requested == null || requested.isEmpty() || isAll(requested)) {
            return null;
        }
        return new HashSet<>(requested);
    }

    private static boolean isAll(List<String> requested) {
        return requested.size() == 1 && ALL_WEIGHTS.equals(requested.get(0).toLowerCase(Locale.ROOT));
    }

    private static Set<String> seasonFilter(List<String> seasons) {
        return seasons == null || seasons.isEmpty() ? null : new HashSet<>(seasons);
    }

    private static LocalDate exclusiveEnd(LocalDate endDate) {
        return endDate == null ? null : endDate.plusDays(1);
    }

    private void writeJson(Path path, LeaderboardPayload payload) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), payload);
            log.info("Wrote leaderboard JSON to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write leaderboard JSON to " + path, e);
        }
    }

    private record PreparedRun(
            Status status,
            String message,
            List<RatingPeriod> periods,
            Overrides overrides,
            Set<String> roster,
            List<String> weightClasses,
            List<MatchResult> matches,
            RecordTally tally,
            List<List<MatchResult>> buckets
    ) {
        static PreparedRun stopped(Status status, String message) {
            return new PreparedRun(status, message, null, null, null, null, null, null, null);
        }
    }
}
