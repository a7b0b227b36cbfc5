package io.github.drompincen.javacron.runtime.remote;

public class RemoteConnectionException extends RuntimeException {

    private final ConnectionFailure failure;

    public RemoteConnectionException(ConnectionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public RemoteConnectionException(ConnectionFailure failure, String message) {
        this(failure, message, null);
    }

    public ConnectionFailure getFailure() {
        return failure;
    }
}
