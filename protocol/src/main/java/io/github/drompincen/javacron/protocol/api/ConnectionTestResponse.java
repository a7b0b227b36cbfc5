package io.github.drompincen.javacron.protocol.api;

public record ConnectionTestResponse(
        boolean success,
        String message
) {}
