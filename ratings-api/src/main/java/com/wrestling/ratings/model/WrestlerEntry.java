package com.wrestling.ratings.model;

/**
 * One wrestler as shown on a leaderboard. Rating and RD are rounded to two
 * decimals, sigma to four.
 */
public record WrestlerEntry(
        String id,
        String name,
        String teamId,
        Integer gradYear,
        double rating,
        double rd,
        double sigma,
        int wins,
        int losses
) {}
