package io.github.drompincen.javacron.persistence.repository;

import io.github.drompincen.javacron.persistence.document.ServerDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ServerRepository extends MongoRepository<ServerDocument, String> {
}
