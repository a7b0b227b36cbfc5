package io.github.drompincen.javacron.protocol.api;

import java.time.Instant;

public record ScheduleStatusResponse(
        String eventId,
        boolean scheduled,
        boolean executing,
        Instant lastFireTime,
        Instant nextRunAt
) {}
