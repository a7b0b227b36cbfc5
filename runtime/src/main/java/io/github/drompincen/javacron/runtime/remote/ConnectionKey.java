package io.github.drompincen.javacron.runtime.remote;

/**
 * Pool identity of a remote connection. Two targets with the same key share a connection.
 */
public record ConnectionKey(String host, String user, int port) {

    @Override
    public String toString() {
        return user + "@" + host + ":" + port;
    }
}
