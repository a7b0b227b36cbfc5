package io.github.drompincen.javacron.protocol.api;

public enum JobStatus {
    QUEUED, CLAIMED, RUNNING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
