package com.wrestling.ratings.repository;

import com.wrestling.ratings.model.LeaderboardDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for generated leaderboards. The only collection this service writes.
 */
@Repository
public interface LeaderboardRepository extends MongoRepository<LeaderboardDocument, String> {

    Optional<LeaderboardDocument> findFirstByOrderByGeneratedAtDesc();
}
