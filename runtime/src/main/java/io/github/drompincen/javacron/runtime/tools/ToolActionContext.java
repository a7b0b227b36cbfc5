package io.github.drompincen.javacron.runtime.tools;

import java.util.Map;

public record ToolActionContext(
        String eventId,
        String userId,
        String toolId,
        Map<String, String> credentials
) {
    public String credential(String name) {
        return credentials == null ? null : credentials.get(name);
    }
}
