package com.wrestling.ratings.exception;

/**
 * Thrown when the volatility root-finder cannot bracket or converge.
 * Indicates bad engine parameters rather than bad data, so callers should not retry.
 */
public class RatingConvergenceException extends RuntimeException {

    public RatingConvergenceException(String message) {
        super(message);
    }
}
