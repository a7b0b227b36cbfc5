package io.github.drompincen.javacron.persistence.repository;

import io.github.drompincen.javacron.persistence.document.ExecutionLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ExecutionLogRepository extends MongoRepository<ExecutionLogDocument, String> {
    Optional<ExecutionLogDocument> findFirstByEventIdOrderByStartTimeDesc(String eventId);
    Optional<ExecutionLogDocument> findByJobId(String jobId);
    List<ExecutionLogDocument> findByEventIdOrderByStartTimeDesc(String eventId);
}
