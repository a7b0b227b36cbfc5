package io.github.drompincen.javacron.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome handed back to callers that launch an event, either immediately after enqueueing
 * or after waiting for the job to finish.
 */
public record ExecutionResult(
        boolean success,
        String output,
        Long durationMs,
        JsonNode scriptOutput,
        Boolean condition,
        String jobId
) {
    public static ExecutionResult queued(String jobId, long durationMs) {
        return new ExecutionResult(true, "Job " + jobId + " created and queued for execution",
                durationMs, null, null, jobId);
    }

    public static ExecutionResult failed(String jobId, String message, long durationMs) {
        return new ExecutionResult(false, message, durationMs, null, null, jobId);
    }
}
