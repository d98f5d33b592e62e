package com.wrestling.ratings.repository.readonly;

import com.wrestling.ratings.model.readonly.EventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EventReadRepository extends MongoRepository<EventDocument, String> {

    @Query("{ 'date': { $gte: ?0, $lt: ?1 } }")
    List<EventDocument> findByDateRange(String start, String endExclusive);
}
