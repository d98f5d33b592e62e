package com.wrestling.ratings.repository.readonly;

import com.wrestling.ratings.model.readonly.TeamDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TeamReadRepository extends MongoRepository<TeamDocument, String> {

    List<TeamDocument> findByIdIn(Collection<String> ids);
}
