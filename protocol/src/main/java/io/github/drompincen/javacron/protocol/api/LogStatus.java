package io.github.drompincen.javacron.protocol.api;

public enum LogStatus {
    PENDING, RUNNING, SUCCESS, FAILURE, TIMEOUT, PARTIAL
}
