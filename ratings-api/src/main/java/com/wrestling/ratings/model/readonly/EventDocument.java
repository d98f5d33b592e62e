package com.wrestling.ratings.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "events")
public class EventDocument {

    @Id
    private String id;

    private String date;
    private String state;
    private String name;
    private Boolean isDual;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getDate() { return date; }
    public String getState() { return state; }
    public String getName() { return name; }
    public Boolean getIsDual() { return isDual; }
}
