package io.github.drompincen.javacron.runtime.remote;

import io.github.drompincen.javacron.persistence.document.ServerDocument;
import io.github.drompincen.javacron.protocol.api.AuthKind;

public record RemoteTarget(
        String host,
        String user,
        int port,
        String credential,
        AuthKind authKind
) {
    /** Key auth when the server carries a key, password auth otherwise. */
    public static RemoteTarget forServer(ServerDocument server) {
        boolean hasKey = server.getSshKey() != null && !server.getSshKey().isBlank();
        return new RemoteTarget(server.getAddress(), server.getUsername(), server.getPort(),
                hasKey ? server.getSshKey() : server.getPassword(),
                hasKey ? AuthKind.PRIVATE_KEY : AuthKind.PASSWORD);
    }

    public ConnectionKey key() {
        return new ConnectionKey(host, user, port);
    }

    // credential deliberately left out
    @Override
    public String toString() {
        return "RemoteTarget[" + key() + ", auth=" + authKind + "]";
    }
}
