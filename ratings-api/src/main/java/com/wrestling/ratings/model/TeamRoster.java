package com.wrestling.ratings.model;

import java.util.List;
import java.util.Map;

/**
 * A team's ranked wrestlers grouped by weight class, classes in leaderboard order.
 */
public record TeamRoster(
        String id,
        String name,
        Integer division,
        String section,
        Map<String, List<String>> weights
) {}
