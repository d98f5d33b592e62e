package com.wrestling.ratings.controller;

import com.wrestling.ratings.exception.ResourceNotFoundException;
import com.wrestling.ratings.model.LeaderboardDocument;
import com.wrestling.ratings.model.LeaderboardRequest;
import com.wrestling.ratings.model.LeaderboardRunResult;
import com.wrestling.ratings.model.RatingPeriod;
import com.wrestling.ratings.service.LeaderboardRunService;
import com.wrestling.ratings.service.TauCalibrationService.TauSelection;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/leaderboards")
@Tag(name = "Leaderboards", description = "Rating runs and weight-class leaderboards")
public class LeaderboardController {

    private final LeaderboardRunService runService;

    public LeaderboardController(LeaderboardRunService runService) {
        this.runService = runService;
    }

    // ============ RUNS ============

    @PostMapping("/run")
    @Operation(summary = "Run ratings and build a leaderboard",
            description = "Rates every period, tunes tau unless one is given, and stores the resulting leaderboard")
    public LeaderboardRunResult run(@RequestBody(required = false) LeaderboardRequest request) {
        return runService.run(request != null ? request : LeaderboardRequest.defaults());
    }

    @PostMapping("/tau/tune")
    @Operation(summary = "Back-test tau candidates",
            description = "Scores each candidate by Brier score over pre-period predictions; nothing is stored")
    public TauSelection tuneTau(@RequestBody(required = false) LeaderboardRequest request) {
        return runService.tuneTau(request != null ? request : LeaderboardRequest.defaults());
    }

    // ============ QUERIES ============

    @GetMapping("/latest")
    @Operation(summary = "Get latest leaderboard", description = "Most recently generated leaderboard")
    public LeaderboardDocument latest() {
        return runService.latest().orElseThrow(ResourceNotFoundException::noLeaderboard);
    }

    @GetMapping("/periods")
    @Operation(summary = "Preview rating periods", description = "Monthly periods a run with these filters would use")
    public List<RatingPeriod> periods(
            @RequestParam(required = false) List<String> season,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        return runService.previewPeriods(season, startDate, endDate);
    }
}
