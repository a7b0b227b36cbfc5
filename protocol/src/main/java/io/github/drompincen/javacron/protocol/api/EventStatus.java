package io.github.drompincen.javacron.protocol.api;

public enum EventStatus {
    DRAFT, ACTIVE, PAUSED
}
