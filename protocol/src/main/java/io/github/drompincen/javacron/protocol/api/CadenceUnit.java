package io.github.drompincen.javacron.protocol.api;

public enum CadenceUnit {
    SECONDS, MINUTES, HOURS, DAYS
}
