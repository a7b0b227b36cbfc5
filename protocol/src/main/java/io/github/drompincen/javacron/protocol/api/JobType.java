package io.github.drompincen.javacron.protocol.api;

public enum JobType {
    SCRIPT, HTTP_REQUEST, TOOL_ACTION;

    public static JobType forEvent(EventType eventType) {
        if (eventType == null) return SCRIPT;
        return switch (eventType) {
            case HTTP_REQUEST -> HTTP_REQUEST;
            case TOOL_ACTION -> TOOL_ACTION;
            default -> SCRIPT;
        };
    }
}
