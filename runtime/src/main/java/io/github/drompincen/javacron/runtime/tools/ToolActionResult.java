package io.github.drompincen.javacron.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolActionResult(
        boolean success,
        JsonNode output,
        String error
) {
    public static ToolActionResult success(JsonNode output) {
        return new ToolActionResult(true, output, null);
    }

    public static ToolActionResult failure(String error) {
        return new ToolActionResult(false, null, error);
    }
}
