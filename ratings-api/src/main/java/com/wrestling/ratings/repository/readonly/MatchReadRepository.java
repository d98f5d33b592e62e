package com.wrestling.ratings.repository.readonly;

import com.wrestling.ratings.model.readonly.MatchDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read-only repository for bouts.
 * Dates are ISO strings, so lexical range comparison matches chronological order.
 */
@Repository
public interface MatchReadRepository extends MongoRepository<MatchDocument, String> {

    @Query("{ 'date': { $gte: ?0, $lt: ?1 } }")
    List<MatchDocument> findByDateRange(String start, String endExclusive);

    @Query("{ 'date': null, 'eventId': { $in: ?0 } }")
    List<MatchDocument> findUndatedByEventIds(Collection<String> eventIds);

    @Query("{ 'winnerId': { $ne: null } }")
    List<MatchDocument> findDecided();
}
