package com.wrestling.ratings.model;

/**
 * Team display metadata; any field may be unknown.
 */
public record TeamInfo(
        String name,
        Integer division,
        String section
) {
    public static TeamInfo empty() {
        return new TeamInfo(null, null, null);
    }

    /**
     * Fill the fields still missing here from {@code other}. Existing values win.
     */
    public TeamInfo mergeMissing(TeamInfo other) {
        if (other == null) return this;
        return new TeamInfo(
                isBlank(name) && !isBlank(other.name) ? other.name : name,
                division == null ? other.division : division,
                isBlank(section) && !isBlank(other.section) ? other.section : section
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
