package com.wrestling.ratings.controller;

import com.wrestling.ratings.repository.LeaderboardRepository;
import com.wrestling.ratings.repository.readonly.MatchReadRepository;
import com.wrestling.ratings.repository.readonly.SeasonReadRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final SeasonReadRepository seasonRepository;
    private final MatchReadRepository matchRepository;
    private final LeaderboardRepository leaderboardRepository;
    private final Clock clock;

    public HealthController(
            SeasonReadRepository seasonRepository,
            MatchReadRepository matchRepository,
            LeaderboardRepository leaderboardRepository,
            Clock clock
    ) {
        this.seasonRepository = seasonRepository;
        this.matchRepository = matchRepository;
        this.leaderboardRepository = leaderboardRepository;
        this.clock = clock;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API and database connectivity")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now(clock));

        // Scraped data (read-only)
        try {
            health.put("seasonCount", seasonRepository.count());
            health.put("matchCount", matchRepository.count());
            health.put("sourceDataAccess", "OK");
        } catch (Exception e) {
            health.put("sourceDataAccess", "ERROR: " + e.getMessage());
        }

        // Generated leaderboards
        try {
            health.put("leaderboardCount", leaderboardRepository.count());
            health.put("leaderboardDataAccess", "OK");
        } catch (Exception e) {
            health.put("leaderboardDataAccess", "ERROR: " + e.getMessage());
        }

        return health;
    }
}
