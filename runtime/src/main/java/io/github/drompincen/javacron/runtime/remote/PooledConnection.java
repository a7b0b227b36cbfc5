package io.github.drompincen.javacron.runtime.remote;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A live session owned by {@link ConnectionPool}. Callers may use the session but must not
 * touch the channel counter except through {@link InteractiveChannel}.
 */
public class PooledConnection {

    private final ConnectionKey key;
    private final RemoteSession session;
    private final Instant createdAt = Instant.now();
    private final AtomicInteger openChannels = new AtomicInteger();
    private final AtomicBoolean retired = new AtomicBoolean();
    private volatile Instant lastUsedAt = Instant.now();

    PooledConnection(ConnectionKey key, RemoteSession session) {
        this.key = key;
        this.session = session;
    }

    boolean tryReserveChannel(int ceiling) {
        while (true) {
            int current = openChannels.get();
            if (current >= ceiling) return false;
            if (openChannels.compareAndSet(current, current + 1)) return true;
        }
    }

    void releaseChannel() {
        openChannels.updateAndGet(c -> c > 0 ? c - 1 : 0);
    }

    boolean markRetired() {
        return retired.compareAndSet(false, true);
    }

    void touch() {
        lastUsedAt = Instant.now();
    }

    void close() {
        session.close();
    }

    public boolean isConnected() {
        return !retired.get() && session.isOpen();
    }

    public ConnectionKey getKey() { return key; }
    public RemoteSession getSession() { return session; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastUsedAt() { return lastUsedAt; }
    public int getOpenChannels() { return openChannels.get(); }
    public boolean isRetired() { return retired.get(); }
}
