package io.github.drompincen.javacron.persistence.repository;

import io.github.drompincen.javacron.persistence.document.ToolCredentialDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ToolCredentialRepository extends MongoRepository<ToolCredentialDocument, String> {
    List<ToolCredentialDocument> findByUserId(String userId);
}
