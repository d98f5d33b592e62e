package com.wrestling.ratings.model;

import java.util.Locale;

/**
 * Victory types recognised by the rating engine, each with the weight its
 * result carries in the Glicko-2 update. Anything unrecognised is {@link #OTHER}.
 */
public enum WinType {

    FALL("F", 1.0),
    TECH_FALL("TF", 0.9),
    MAJOR_DECISION("MD", 0.8),
    DECISION("DEC", 0.7),
    OTHER(null, 0.65);

    private final String code;
    private final double weight;

    WinType(String code, double weight) {
        this.code = code;
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    /**
     * Case-insensitive lookup; null, blank and unknown codes map to {@link #OTHER}.
     */
    public static WinType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return OTHER;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (WinType type : values()) {
            if (normalized.equals(type.code)) {
                return type;
            }
        }
        return OTHER;
    }
}
