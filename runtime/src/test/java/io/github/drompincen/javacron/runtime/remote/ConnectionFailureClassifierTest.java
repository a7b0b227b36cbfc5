package io.github.drompincen.javacron.runtime.remote;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionFailureClassifierTest {

    private static final ConnectionKey KEY = new ConnectionKey("10.0.0.5", "ops", 2222);

    @Test
    void classifiesByExceptionTypeAnywhereInChain() {
        assertThat(ConnectionFailureClassifier.classify(new IOException("wrapped", new ConnectException("x"))))
                .isEqualTo(ConnectionFailure.REFUSED);
        assertThat(ConnectionFailureClassifier.classify(new UnknownHostException("nope.example")))
                .isEqualTo(ConnectionFailure.UNRESOLVED_HOST);
        assertThat(ConnectionFailureClassifier.classify(new NoRouteToHostException()))
                .isEqualTo(ConnectionFailure.UNREACHABLE);
        assertThat(ConnectionFailureClassifier.classify(new SocketTimeoutException()))
                .isEqualTo(ConnectionFailure.TIMED_OUT);
    }

    @Test
    void classifiesByMessage() {
        assertThat(ConnectionFailureClassifier.classify(new IOException("connect ECONNREFUSED 10.0.0.5:2222")))
                .isEqualTo(ConnectionFailure.REFUSED);
        assertThat(ConnectionFailureClassifier.classify(new IOException("No more authentication methods available")))
                .isEqualTo(ConnectionFailure.AUTH_FAILED);
        assertThat(ConnectionFailureClassifier.classify(new IOException("connect EHOSTUNREACH")))
                .isEqualTo(ConnectionFailure.UNREACHABLE);
        assertThat(ConnectionFailureClassifier.classify(new IOException("something odd")))
                .isEqualTo(ConnectionFailure.GENERIC);
    }

    @Test
    void exceptionMessageNamesTheKeyAndKeepsDetail() {
        RemoteConnectionException e = ConnectionFailureClassifier.toException(KEY, new ConnectException("Connection refused"));

        assertThat(e.getFailure()).isEqualTo(ConnectionFailure.REFUSED);
        assertThat(e.getMessage()).startsWith("Connection refused by ops@10.0.0.5:2222.")
                .endsWith("(Connection refused)");
    }

    @Test
    void existingRemoteConnectionExceptionPassesThrough() {
        RemoteConnectionException original = new RemoteConnectionException(ConnectionFailure.CHANNEL_LIMIT, "full");

        assertThat(ConnectionFailureClassifier.toException(KEY, original)).isSameAs(original);
    }
}
