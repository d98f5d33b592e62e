package com.wrestling.ratings.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A stored leaderboard run.
 */
@Document(collection = "leaderboards")
public class LeaderboardDocument {

    @Id
    private String id;

    @Indexed
    private Instant generatedAt;

    private double tau;

    // Back-test metrics, null when tau was given explicitly
    private Double brier;
    private Double accuracy;

    private int matchCount;
    private int periodCount;

    private LeaderboardPayload payload;

    public LeaderboardDocument() {
    }

    public LeaderboardDocument(Instant generatedAt, LeaderboardPayload payload, Double brier, Double accuracy) {
        this.generatedAt = generatedAt;
        this.payload = payload;
        this.tau = payload.tau();
        this.matchCount = payload.matches();
        this.periodCount = payload.periods();
        this.brier = brier;
        this.accuracy = accuracy;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Instant getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(Instant generatedAt) { this.generatedAt = generatedAt; }

    public double getTau() { return tau; }
    public void setTau(double tau) { this.tau = tau; }

    public Double getBrier() { return brier; }
    public void setBrier(Double brier) { this.brier = brier; }

    public Double getAccuracy() { return accuracy; }
    public void setAccuracy(Double accuracy) { this.accuracy = accuracy; }

    public int getMatchCount() { return matchCount; }
    public void setMatchCount(int matchCount) { this.matchCount = matchCount; }

    public int getPeriodCount() { return periodCount; }
    public void setPeriodCount(int periodCount) { this.periodCount = periodCount; }

    public LeaderboardPayload getPayload() { return payload; }
    public void setPayload(LeaderboardPayload payload) { this.payload = payload; }
}
