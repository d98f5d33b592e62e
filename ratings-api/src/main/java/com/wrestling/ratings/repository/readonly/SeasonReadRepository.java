package com.wrestling.ratings.repository.readonly;

import com.wrestling.ratings.model.readonly.SeasonDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only repository for season boundaries.
 */
@Repository
public interface SeasonReadRepository extends MongoRepository<SeasonDocument, String> {
}
