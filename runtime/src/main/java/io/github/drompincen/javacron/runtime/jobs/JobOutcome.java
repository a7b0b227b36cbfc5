package io.github.drompincen.javacron.runtime.jobs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a worker learned from running a job. {@code exitCode} is -1 for a timeout.
 */
public record JobOutcome(
        boolean success,
        Integer exitCode,
        String output,
        String error,
        JsonNode scriptOutput,
        Boolean condition
) {
    public static JobOutcome failure(String error) {
        return new JobOutcome(false, 1, "", error, null, null);
    }
}
