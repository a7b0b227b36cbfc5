package io.github.drompincen.javacron.persistence.repository;

import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.protocol.api.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface JobRepository extends MongoRepository<JobDocument, String> {
    List<JobDocument> findByStatusOrderByPriorityDescCreatedAtAsc(JobStatus status, Pageable pageable);
    List<JobDocument> findByEventIdAndStatusIn(String eventId, List<JobStatus> statuses);
}
