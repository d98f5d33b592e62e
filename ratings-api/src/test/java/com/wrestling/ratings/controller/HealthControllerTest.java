package com.wrestling.ratings.controller;

import com.wrestling.ratings.repository.LeaderboardRepository;
import com.wrestling.ratings.repository.readonly.MatchReadRepository;
import com.wrestling.ratings.repository.readonly.SeasonReadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthControllerTest {

    SeasonReadRepository seasonRepository;
    MatchReadRepository matchRepository;
    LeaderboardRepository leaderboardRepository;
    HealthController controller;

    @BeforeEach
    void setUp() {
        seasonRepository = mock(SeasonReadRepository.class);
        matchRepository = mock(MatchReadRepository.class);
        leaderboardRepository = mock(LeaderboardRepository.class);
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneId.of("UTC"));
        controller = new HealthController(seasonRepository, matchRepository, leaderboardRepository, clock);
    }

    @Test
    void reportsCounts() {
        when(seasonRepository.count()).thenReturn(3L);
        when(matchRepository.count()).thenReturn(1200L);
        when(leaderboardRepository.count()).thenReturn(7L);

        Map<String, Object> health = controller.health();

        assertEquals("UP", health.get("status"));
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), health.get("timestamp"));
        assertEquals(1200L, health.get("matchCount"));
        assertEquals("OK", health.get("sourceDataAccess"));
        assertEquals(7L, health.get("leaderboardCount"));
    }

    @Test
    void databaseErrorsAreReportedNotThrown() {
        when(seasonRepository.count()).thenThrow(new IllegalStateException("connection refused"));

        Map<String, Object> health = controller.health();

        assertEquals("UP", health.get("status"));
        assertEquals("ERROR: connection refused", health.get("sourceDataAccess"));
        assertEquals("OK", health.get("leaderboardDataAccess"));
    }
}
