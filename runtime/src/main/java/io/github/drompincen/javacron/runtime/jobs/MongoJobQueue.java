package io.github.drompincen.javacron.runtime.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.persistence.repository.JobRepository;
import io.github.drompincen.javacron.protocol.api.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class MongoJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(MongoJobQueue.class);

    private final JobRepository jobRepository;
    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobQueue(JobRepository jobRepository, MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.jobRepository = jobRepository;
        this.mongoTemplate = mongoTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public JobDocument createJob(JobRequest request) {
        JobDocument job = new JobDocument();
        job.setJobId(UUID.randomUUID().toString());
        job.setEventId(request.eventId());
        job.setUserId(request.userId());
        job.setType(request.type());
        job.setStatus(JobStatus.QUEUED);
        job.setPriority(request.priority());
        job.setPayload(request.payload());
        job.setMetadata(request.metadata());
        job.setCreatedAt(Instant.now());
        job.setUpdatedAt(Instant.now());
        return jobRepository.save(job);
    }

    @Override
    public List<JobDocument> claimNext(int limit, String workerId) {
        List<JobDocument> candidates = jobRepository.findByStatusOrderByPriorityDescCreatedAtAsc(
                JobStatus.QUEUED, PageRequest.of(0, limit));
        List<JobDocument> claimed = new ArrayList<>();
        for (JobDocument candidate : candidates) {
            // Only succeeds while the job is still QUEUED, so two workers cannot both claim it.
            Instant now = Instant.now();
            JobDocument job = mongoTemplate.findAndModify(
                    Query.query(Criteria.where("_id").is(candidate.getJobId()).and("status").is(JobStatus.QUEUED)),
                    new Update().set("status", JobStatus.CLAIMED)
                            .set("lockOwner", workerId)
                            .set("claimedAt", now)
                            .set("updatedAt", now)
                            .inc("attempts", 1),
                    FindAndModifyOptions.options().returnNew(true),
                    JobDocument.class);
            if (job != null) {
                log.debug("Worker {} claimed job {}", workerId, job.getJobId());
                claimed.add(job);
            }
        }
        return claimed;
    }

    @Override
    public Optional<JobDocument> markRunning(String jobId) {
        return jobRepository.findById(jobId)
                .filter(job -> !job.getStatus().isTerminal())
                .map(job -> {
                    job.setStatus(JobStatus.RUNNING);
                    job.setStartedAt(Instant.now());
                    job.setUpdatedAt(Instant.now());
                    return jobRepository.save(job);
                });
    }

    @Override
    public Optional<JobDocument> finish(String jobId, JobOutcome outcome) {
        return jobRepository.findById(jobId).map(job -> {
            if (job.getStatus() == JobStatus.CANCELLED) {
                return job;
            }
            job.setStatus(outcome.success() ? JobStatus.COMPLETED : JobStatus.FAILED);
            job.setExitCode(outcome.exitCode());
            job.setOutput(outcome.output());
            job.setError(outcome.error());
            Map<String, Object> result = new HashMap<>();
            if (outcome.scriptOutput() != null) {
                result.put(JobPayload.RESULT_SCRIPT_OUTPUT, objectMapper.convertValue(outcome.scriptOutput(), Object.class));
            }
            if (outcome.condition() != null) {
                result.put(JobPayload.RESULT_CONDITION, outcome.condition());
            }
            job.setResult(result);
            job.setCompletedAt(Instant.now());
            job.setUpdatedAt(Instant.now());
            return jobRepository.save(job);
        });
    }

    @Override
    public boolean cancel(String jobId) {
        return jobRepository.findById(jobId)
                .filter(job -> !job.getStatus().isTerminal())
                .map(job -> {
                    job.setStatus(JobStatus.CANCELLED);
                    job.setCompletedAt(Instant.now());
                    job.setUpdatedAt(Instant.now());
                    jobRepository.save(job);
                    return true;
                })
                .orElse(false);
    }

    @Override
    public Optional<JobDocument> find(String jobId) {
        return jobRepository.findById(jobId);
    }
}
