package io.github.drompincen.javacron.runtime.remote;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on an interactive shell opened through the pool. The channel slot it holds is given back
 * exactly once, whichever of {@link #close()} or the remote end comes first.
 */
public class InteractiveChannel implements AutoCloseable {

    private final PooledConnection connection;
    private final InteractiveShell shell;
    private final AtomicBoolean released = new AtomicBoolean();

    InteractiveChannel(PooledConnection connection, InteractiveShell shell) {
        this.connection = connection;
        this.shell = shell;
        shell.whenClosed(this::release);
    }

    void release() {
        if (released.compareAndSet(false, true)) {
            connection.releaseChannel();
        }
    }

    public OutputStream stdin() { return shell.stdin(); }
    public InputStream stdout() { return shell.stdout(); }
    public InputStream stderr() { return shell.stderr(); }
    public ConnectionKey getConnectionKey() { return connection.getKey(); }
    public boolean isOpen() { return !released.get() && shell.isOpen(); }

    @Override
    public void close() {
        try {
            shell.close();
        } finally {
            release();
        }
    }
}
