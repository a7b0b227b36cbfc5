package io.github.drompincen.javacron.protocol.api;

import java.util.Map;

public record RunEventRequest(
        Map<String, Object> input,
        Boolean waitForCompletion
) {}
