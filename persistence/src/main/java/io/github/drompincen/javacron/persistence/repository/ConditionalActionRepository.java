package io.github.drompincen.javacron.persistence.repository;

import io.github.drompincen.javacron.persistence.document.ConditionalActionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ConditionalActionRepository extends MongoRepository<ConditionalActionDocument, String> {
    List<ConditionalActionDocument> findBySuccessEventIdOrderByCreatedAtAsc(String eventId);
    List<ConditionalActionDocument> findByFailEventIdOrderByCreatedAtAsc(String eventId);
    List<ConditionalActionDocument> findByAlwaysEventIdOrderByCreatedAtAsc(String eventId);
    List<ConditionalActionDocument> findByConditionEventIdOrderByCreatedAtAsc(String eventId);
}
