package com.wrestling.ratings.repository.readonly;

import com.wrestling.ratings.model.readonly.WrestlerDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface WrestlerReadRepository extends MongoRepository<WrestlerDocument, String> {

    List<WrestlerDocument> findByIdIn(Collection<String> ids);
}
