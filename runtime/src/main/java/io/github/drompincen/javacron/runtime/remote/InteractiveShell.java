package io.github.drompincen.javacron.runtime.remote;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * A PTY-backed shell sub-channel on an open session.
 */
public interface InteractiveShell {

    OutputStream stdin();

    InputStream stdout();

    InputStream stderr();

    boolean isOpen();

    /** Registers a callback run once when the remote side ends the channel. */
    void whenClosed(Runnable callback);

    void close();
}
