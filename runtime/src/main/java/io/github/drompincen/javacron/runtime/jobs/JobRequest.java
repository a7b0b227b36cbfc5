package io.github.drompincen.javacron.runtime.jobs;

import io.github.drompincen.javacron.protocol.api.JobType;

import java.util.Map;

public record JobRequest(
        String eventId,
        String userId,
        JobType type,
        Map<String, Object> payload,
        Map<String, Object> metadata,
        int priority
) {}
