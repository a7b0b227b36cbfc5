package io.github.drompincen.javacron.runtime.remote;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * One authenticated session to a host. Implementations must allow concurrent sub-channels.
 */
public interface RemoteSession extends AutoCloseable {

    /**
     * Runs a command line and collects its output. Never throws for a failing or timed-out
     * command; those come back as a {@link CommandResult}.
     */
    CommandResult exec(String command, Duration timeout);

    void writeFile(String path, byte[] content) throws IOException;

    /** Empty when the file does not exist. */
    Optional<byte[]> readFile(String path) throws IOException;

    InteractiveShell openShell(int cols, int rows) throws IOException;

    boolean isOpen();

    @Override
    void close();
}
