package io.github.drompincen.javacron.runtime.scheduler;

public class UnsupportedCadenceException extends RuntimeException {

    public UnsupportedCadenceException(String message) {
        super(message);
    }

    public UnsupportedCadenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
