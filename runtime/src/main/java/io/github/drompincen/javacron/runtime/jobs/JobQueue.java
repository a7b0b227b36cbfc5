package io.github.drompincen.javacron.runtime.jobs;

import io.github.drompincen.javacron.persistence.document.JobDocument;

import java.util.List;
import java.util.Optional;

/**
 * Durable queue of units of work. Status moves
 * {@code QUEUED -> CLAIMED -> RUNNING -> COMPLETED | FAILED | CANCELLED}.
 */
public interface JobQueue {

    JobDocument createJob(JobRequest request);

    /** Claims up to {@code limit} queued jobs, highest priority first. A job is claimed by one worker only. */
    List<JobDocument> claimNext(int limit, String workerId);

    /** Moves a claimed job to {@code RUNNING}; empty when the job is gone or already terminal. */
    Optional<JobDocument> markRunning(String jobId);

    /** Records the outcome: {@code COMPLETED} when it succeeded, {@code FAILED} otherwise. */
    Optional<JobDocument> finish(String jobId, JobOutcome outcome);

    /** Cancels a job that has not reached a terminal status. */
    boolean cancel(String jobId);

    Optional<JobDocument> find(String jobId);
}
