package io.github.drompincen.javacron.persistence.repository;

import io.github.drompincen.javacron.persistence.document.UserVariableDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface UserVariableRepository extends MongoRepository<UserVariableDocument, String> {
    List<UserVariableDocument> findByUserId(String userId);
    Optional<UserVariableDocument> findByUserIdAndKey(String userId, String key);
    void deleteByUserIdAndKey(String userId, String key);
}
