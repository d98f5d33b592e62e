package com.wrestling.ratings.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "ratings")
public class RatingsProperties {

    private List<Double> tauCandidates = new ArrayList<>(List.of(0.1, 0.2, 0.3, 0.4, 0.5, 0.7));
    private double minRd = 30.0;
    private double maxRd = 350.0;
    private double seasonRdFloor = 150.0;
    private int weightHistoryLimit = 5;
    private int minWins = 1;
    private List<String> weightClasses = new ArrayList<>(List.of(
            "106", "113", "120", "126", "132", "138", "144",
            "150", "157", "165", "175", "190", "215", "285"
    ));

    /**
     * Optional JSON file with per-wrestler overrides (weight, exclude, gradYear, teamId).
     */
    private String overridesPath;

    /**
     * Optional path the latest leaderboard payload is written to.
     */
    private String jsonOutputPath;

    public List<Double> getTauCandidates() {
        return tauCandidates;
    }

    public void setTauCandidates(List<Double> tauCandidates) {
        this.tauCandidates = tauCandidates;
    }

    public double getMinRd() {
        return minRd;
    }

    public void setMinRd(double minRd) {
        this.minRd = minRd;
    }

    public double getMaxRd() {
        return maxRd;
    }

    public void setMaxRd(double maxRd) {
        this.maxRd = maxRd;
    }

    public double getSeasonRdFloor() {
        return seasonRdFloor;
    }

    public void setSeasonRdFloor(double seasonRdFloor) {
        this.seasonRdFloor = seasonRdFloor;
    }

    public int getWeightHistoryLimit() {
        return weightHistoryLimit;
    }

    public void setWeightHistoryLimit(int weightHistoryLimit) {
        this.weightHistoryLimit = weightHistoryLimit;
    }

    public int getMinWins() {
        return minWins;
    }

    public void setMinWins(int minWins) {
        this.minWins = minWins;
    }

    public List<String> getWeightClasses() {
        return weightClasses;
    }

    public void setWeightClasses(List<String> weightClasses) {
        this.weightClasses = weightClasses;
    }

    public String getOverridesPath() {
        return overridesPath;
    }

    public void setOverridesPath(String overridesPath) {
        this.overridesPath = overridesPath;
    }

    public String getJsonOutputPath() {
        return jsonOutputPath;
    }

    public void setJsonOutputPath(String jsonOutputPath) {
        this.jsonOutputPath = jsonOutputPath;
    }
}
