package io.github.drompincen.javacron.runtime.remote;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw transport exceptions onto {@link ConnectionFailure}. Walks the whole cause chain
 * because the SSH stack usually wraps the socket error.
 */
public final class ConnectionFailureClassifier {

    private ConnectionFailureClassifier() {}

    public static ConnectionFailure classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof RemoteConnectionException rce) return rce.getFailure();
            if (t instanceof UnknownHostException) return ConnectionFailure.UNRESOLVED_HOST;
            if (t instanceof NoRouteToHostException) return ConnectionFailure.UNREACHABLE;
            if (t instanceof SocketTimeoutException || t instanceof TimeoutException) return ConnectionFailure.TIMED_OUT;
            if (t instanceof ConnectException) return ConnectionFailure.REFUSED;

            String msg = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (msg.contains("econnrefused") || msg.contains("connection refused")) return ConnectionFailure.REFUSED;
            if (msg.contains("timed out") || msg.contains("timeout")) return ConnectionFailure.TIMED_OUT;
            if (msg.contains("auth")) return ConnectionFailure.AUTH_FAILED;
            if (msg.contains("ehostunreach") || msg.contains("unreachable")) return ConnectionFailure.UNREACHABLE;
            if (msg.contains("enotfound") || msg.contains("unknown host")) return ConnectionFailure.UNRESOLVED_HOST;
        }
        return ConnectionFailure.GENERIC;
    }

    public static RemoteConnectionException toException(ConnectionKey key, Throwable error) {
        if (error instanceof RemoteConnectionException rce) return rce;
        ConnectionFailure failure = classify(error);
        String detail = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new RemoteConnectionException(failure, failure.describe(key) + " (" + detail + ")", error);
    }
}
