package com.wrestling.ratings.model;

/**
 * Glicko-2 state of one wrestler on the public (Glicko-1) scale.
 */
public record RatingState(
        double rating,
        double rd,
        double sigma
) {
    public static final double DEFAULT_RATING = 1500.0;
    public static final double DEFAULT_RD = 350.0;
    public static final double DEFAULT_SIGMA = 0.06;

    public static RatingState initial() {
        return new RatingState(DEFAULT_RATING, DEFAULT_RD, DEFAULT_SIGMA);
    }

    public RatingState withRd(double newRd) {
        return new RatingState(rating, newRd, sigma);
    }

    public boolean isFinite() {
        return Double.isFinite(rating) && Double.isFinite(rd) && Double.isFinite(sigma);
    }
}
