package com.wrestling.ratings.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only team record. Division is a number (school size class), section is
 * the regional grouping.
 */
@Document(collection = "teams")
public class TeamDocument {

    @Id
    private String id;

    private String name;
    private String state;
    private Integer division;
    private String section;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getName() { return name; }
    public String getState() { return state; }
    public Integer getDivision() { return division; }
    public String getSection() { return section; }
}
