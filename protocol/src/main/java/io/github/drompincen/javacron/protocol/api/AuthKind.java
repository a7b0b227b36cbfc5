package io.github.drompincen.javacron.protocol.api;

public enum AuthKind {
    PRIVATE_KEY, PASSWORD
}
