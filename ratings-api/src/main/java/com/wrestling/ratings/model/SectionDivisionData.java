package com.wrestling.ratings.model;

import java.util.List;

/**
 * Distinct sections and divisions represented on a leaderboard, both sorted.
 */
public record SectionDivisionData(
        List<String> sections,
        List<Integer> divisions
) {}
