package com.wrestling.ratings.model;

/**
 * Pre-match win probability for the top wrestler and what actually happened
 * (1.0 top won, 0.0 bottom won).
 */
public record Prediction(
        double probability,
        double actual
) {
    public boolean isCorrect() {
        return (probability >= 0.5 && actual == 1.0) || (probability < 0.5 && actual == 0.0);
    }

    public double squaredError() {
        double diff = probability - actual;
        return diff * diff;
    }
}
