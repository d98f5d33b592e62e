package com.wrestling.ratings.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only season boundaries as loaded by the scraper.
 * Dates are kept as the raw strings the upstream site publishes.
 */
@Document(collection = "seasons")
public class SeasonDocument {

    @Id
    private String id;

    private String name;
    private SeasonPhase regular;
    private SeasonPhase post;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getName() { return name; }
    public SeasonPhase getRegular() { return regular; }
    public SeasonPhase getPost() { return post; }

    public String getRegularStartDate() {
        return regular != null ? regular.getStartDate() : null;
    }

    public String getPostEndDate() {
        return post != null ? post.getEndDate() : null;
    }

    public static class SeasonPhase {
        private String startDate;
        private String endDate;

        public String getStartDate() { return startDate; }
        public String getEndDate() { return endDate; }
    }
}
