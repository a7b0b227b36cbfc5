package io.github.drompincen.javacron.runtime.remote;

public enum ConnectionFailure {

    REFUSED("Connection refused by %s. Check that the SSH service is running and the port is correct."),
    TIMED_OUT("Connection to %s timed out. Check the address and any firewall between the hosts."),
    AUTH_FAILED("Authentication failed for %s. Check the username and the key or password."),
    UNREACHABLE("Host %s is unreachable. Check the network route to the server."),
    UNRESOLVED_HOST("Host name of %s could not be resolved. Check the server address."),
    CHANNEL_LIMIT("Could not open a channel on %s after replacing the connection."),
    GENERIC("Connection to %s failed.");

    private final String template;

    ConnectionFailure(String template) {
        this.template = template;
    }

    public String describe(ConnectionKey key) {
        return String.format(template, key);
    }
}
