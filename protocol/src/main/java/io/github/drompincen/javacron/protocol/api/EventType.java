package io.github.drompincen.javacron.protocol.api;

public enum EventType {
    BASH, PYTHON, NODEJS, HTTP_REQUEST, TOOL_ACTION;

    public boolean isScript() {
        return this == BASH || this == PYTHON || this == NODEJS;
    }
}
