package com.wrestling.ratings.model;

/**
 * Display metadata for a wrestler, after overrides have been applied.
 */
public record AthleteInfo(
        String id,
        String name,
        String teamId,
        Integer gradYear
) {}
