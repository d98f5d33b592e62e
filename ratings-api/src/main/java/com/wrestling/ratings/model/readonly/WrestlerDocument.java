package com.wrestling.ratings.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "wrestlers")
public class WrestlerDocument {

    @Id
    private String id;

    private String name;
    private String state;
    private Integer gradYear;
    private String dateOfBirth;
    private String teamId;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getName() { return name; }
    public String getState() { return state; }
    public Integer getGradYear() { return gradYear; }
    public String getDateOfBirth() { return dateOfBirth; }
    public String getTeamId() { return teamId; }
}
