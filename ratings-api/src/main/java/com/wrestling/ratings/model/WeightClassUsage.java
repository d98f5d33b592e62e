package com.wrestling.ratings.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sliding window of the weight classes each wrestler competed at most recently.
 *
 * The primary weight class is the mode of the window. When several classes
 * share the highest count, the one that entered the counter first (and has not
 * dropped out of the window since) wins.
 */
public class WeightClassUsage {

    public static final int DEFAULT_HISTORY_LIMIT = 5;

    private final int historyLimit;
    private final Map<String, Deque<String>> history = new HashMap<>();
    private final Map<String, Map<String, Integer>> counts = new LinkedHashMap<>();

    public WeightClassUsage() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    public WeightClassUsage(int historyLimit) {
        this.historyLimit = Math.max(1, historyLimit);
    }

    public void record(String wrestlerId, String weightClass) {
        if (weightClass == null || weightClass.isEmpty()) {
            return;
        }
        Deque<String> window = history.computeIfAbsent(wrestlerId, id -> new ArrayDeque<>());
        Map<String, Integer> wrestlerCounts = counts.computeIfAbsent(wrestlerId, id -> new LinkedHashMap<>());

        window.addLast(weightClass);
        wrestlerCounts.merge(weightClass, 1, Integer::sum);

        if (window.size() > historyLimit) {
            String removed = window.removeFirst();
            int remaining = wrestlerCounts.merge(removed, -1, Integer::sum);
            if (remaining <= 0) {
                wrestlerCounts.remove(removed);
            }
        }
    }

    /**
     * Most common recent weight class, or null when the wrestler has none recorded.
     */
    public String primaryWeightClass(String wrestlerId) {
        Map<String, Integer> wrestlerCounts = counts.get(wrestlerId);
        if (wrestlerCounts == null || wrestlerCounts.isEmpty()) {
            return null;
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : wrestlerCounts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public Map<String, Integer> counts(String wrestlerId) {
        return Collections.unmodifiableMap(counts.getOrDefault(wrestlerId, Map.of()));
    }

    public int historyLimit() {
        return historyLimit;
    }
}
