package io.github.drompincen.javacron.protocol.api;

public enum ConditionalActionType {
    SEND_MESSAGE, SCRIPT
}
