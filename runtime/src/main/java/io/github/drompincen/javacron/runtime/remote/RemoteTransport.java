package io.github.drompincen.javacron.runtime.remote;

import java.time.Duration;

public interface RemoteTransport {

    /**
     * Opens and authenticates a new session.
     *
     * @throws RemoteConnectionException with a classified cause when the session cannot be established
     */
    RemoteSession connect(RemoteTarget target, Duration connectTimeout);
}
