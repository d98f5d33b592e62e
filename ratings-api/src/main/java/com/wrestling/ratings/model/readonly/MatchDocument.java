package com.wrestling.ratings.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only bout record. {@code date} is often missing, in which case the
 * owning event's date applies.
 */
@Document(collection = "matches")
public class MatchDocument {

    @Id
    private String id;

    private String topId;
    private String bottomId;
    private String winnerId;
    private String winType;
    private String eventId;
    private String weightClass;
    private String date;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getTopId() { return topId; }
    public String getBottomId() { return bottomId; }
    public String getWinnerId() { return winnerId; }
    public String getWinType() { return winType; }
    public String getEventId() { return eventId; }
    public String getWeightClass() { return weightClass; }
    public String getDate() { return date; }
}
