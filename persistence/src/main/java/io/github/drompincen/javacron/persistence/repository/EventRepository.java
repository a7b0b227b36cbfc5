package io.github.drompincen.javacron.persistence.repository;

import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.protocol.api.EventStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface EventRepository extends MongoRepository<EventDocument, String> {
    List<EventDocument> findByStatus(EventStatus status);
    List<EventDocument> findByUserId(String userId);
}
