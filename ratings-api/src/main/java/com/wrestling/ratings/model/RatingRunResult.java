package com.wrestling.ratings.model;

import java.util.List;
import java.util.Map;

/**
 * Everything one full simulation produces. {@code ratings} keeps the order in
 * which wrestlers were first tracked.
 */
public record RatingRunResult(
        Map<String, RatingState> ratings,
        HeadToHead headToHead,
        WeightClassUsage weightUsage,
        List<Prediction> predictions
) {
    public RatingState rating(String wrestlerId) {
        return ratings.get(wrestlerId);
    }
}
