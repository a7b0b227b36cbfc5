package io.github.drompincen.javacron.protocol.api;

import java.util.Map;

public record ToolActionConfig(
        String toolType,
        String actionId,
        String toolId,
        Map<String, Object> parameters
) {}
