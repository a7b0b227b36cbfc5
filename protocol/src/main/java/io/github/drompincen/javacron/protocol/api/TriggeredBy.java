package io.github.drompincen.javacron.protocol.api;

public enum TriggeredBy {
    SCHEDULE, MANUAL, CONDITIONAL_ACTION, WORKFLOW
}
