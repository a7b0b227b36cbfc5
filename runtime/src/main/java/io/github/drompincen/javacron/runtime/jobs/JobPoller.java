package io.github.drompincen.javacron.runtime.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.protocol.api.ExecutionResult;
import io.github.drompincen.javacron.protocol.api.JobStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Synchronous wait on a queued job for callers that need its result, polled at a fixed interval.
 */
@Component
public class JobPoller {

    private final JobQueue jobQueue;
    private final ObjectMapper objectMapper;

    public JobPoller(JobQueue jobQueue, ObjectMapper objectMapper) {
        this.jobQueue = jobQueue;
        this.objectMapper = objectMapper;
    }

    public ExecutionResult waitForCompletion(String jobId, Duration timeout, Duration pollInterval) {
        long start = System.currentTimeMillis();
        long deadline = start + timeout.toMillis();
        while (true) {
            Optional<JobDocument> job = jobQueue.find(jobId);
            long elapsed = System.currentTimeMillis() - start;
            if (job.isEmpty()) {
                return ExecutionResult.failed(jobId, "Job " + jobId + " not found", elapsed);
            }
            if (job.get().getStatus().isTerminal()) {
                return toResult(job.get(), elapsed);
            }
            if (System.currentTimeMillis() >= deadline) {
                return ExecutionResult.failed(jobId,
                        "Job " + jobId + " did not finish within " + timeout.toSeconds() + "s", elapsed);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ExecutionResult.failed(jobId, "Interrupted while waiting for job " + jobId, elapsed);
            }
        }
    }

    ExecutionResult toResult(JobDocument job, long elapsed) {
        boolean success = job.getStatus() == JobStatus.COMPLETED;
        String output = success || job.getError() == null ? job.getOutput() : job.getError();
        Map<String, Object> result = job.getResult() == null ? Map.of() : job.getResult();
        Object scriptOutput = result.get(JobPayload.RESULT_SCRIPT_OUTPUT);
        Object condition = result.get(JobPayload.RESULT_CONDITION);
        return new ExecutionResult(success, output, elapsed,
                scriptOutput == null ? null : objectMapper.valueToTree(scriptOutput),
                condition instanceof Boolean b ? b : null,
                job.getJobId());
    }
}
