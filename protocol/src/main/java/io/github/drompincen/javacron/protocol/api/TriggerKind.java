package io.github.drompincen.javacron.protocol.api;

/**
 * Outcome of a run that a conditional action is wired to.
 */
public enum TriggerKind {
    SUCCESS, FAILURE, ALWAYS, CONDITION
}
