package io.github.drompincen.javacron.runtime.remote;

import io.github.drompincen.javacron.protocol.api.ConnectionTestResponse;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.Function;

/**
 * Long-lived remote sessions keyed by {@code (host, user, port)}.
 *
 * <p>Concurrent acquires for the same key share one connect attempt. A failed attempt is not
 * cached: the next caller starts a fresh one. Each connection carries a channel ceiling; when it
 * is reached the connection is retired (closed once its channels drain or the grace period runs
 * out) and a fresh one takes its place under the same key.
 */
@Service
public class ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
    private static final String FALLBACK_SHELL = "/bin/bash";
    private static final int MAX_RETIRE_CHECKS = 12;

    private final RemoteTransport transport;
    private final int maxChannelsPerConnection;
    private final Duration idleTimeout;
    private final Duration connectTimeout;
    private final Duration livenessTimeout;
    private final Duration retireGrace;

    private final Map<ConnectionKey, PooledConnection> connections = new ConcurrentHashMap<>();
    private final Map<ConnectionKey, CompletableFuture<PooledConnection>> inFlight = new ConcurrentHashMap<>();
    private final Map<ConnectionKey, String> shellCache = new ConcurrentHashMap<>();
    private final ScheduledExecutorService housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "connection-pool");
        t.setDaemon(true);
        return t;
    });

    public ConnectionPool(RemoteTransport transport,
                          @Value("${javacron.remote.max-channels-per-connection:5}") int maxChannelsPerConnection,
                          @Value("${javacron.remote.idle-timeout-ms:300000}") long idleTimeoutMs,
                          @Value("${javacron.remote.connect-timeout-ms:20000}") long connectTimeoutMs,
                          @Value("${javacron.remote.liveness-timeout-ms:5000}") long livenessTimeoutMs,
                          @Value("${javacron.remote.retire-grace-ms:5000}") long retireGraceMs) {
        this.transport = transport;
        this.maxChannelsPerConnection = maxChannelsPerConnection;
        this.idleTimeout = Duration.ofMillis(idleTimeoutMs);
        this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
        this.livenessTimeout = Duration.ofMillis(livenessTimeoutMs);
        this.retireGrace = Duration.ofMillis(retireGraceMs);
    }

    // ------------------------------------------------------------------
    // Acquire
    // ------------------------------------------------------------------

    public PooledConnection acquire(RemoteTarget target, boolean forceNew) {
        ConnectionKey key = target.key();
        if (!forceNew) {
            PooledConnection cached = connections.get(key);
            if (cached != null) {
                if (cached.isConnected() && isAlive(cached)) {
                    cached.touch();
                    return cached;
                }
                log.info("Evicting unhealthy connection {}", key);
                evict(cached);
            }
        }
        return connectOnce(target, forceNew);
    }

    PooledConnection connectOnce(RemoteTarget target, boolean forceNew) {
        ConnectionKey key = target.key();
        CompletableFuture<PooledConnection> attempt = new CompletableFuture<>();
        CompletableFuture<PooledConnection> existing = inFlight.putIfAbsent(key, attempt);
        if (existing != null) {
            log.debug("Joining in-flight connect for {}", key);
            return await(key, existing);
        }

        try {
            // Another caller may have finished connecting between the cache read and the claim.
            PooledConnection settled = forceNew ? null : connections.get(key);
            if (settled != null && settled.isConnected()) {
                settled.touch();
                attempt.complete(settled);
                return settled;
            }
            RemoteSession session = transport.connect(target, connectTimeout);
            PooledConnection connection = new PooledConnection(key, session);
            PooledConnection previous = connections.put(key, connection);
            if (previous != null) {
                retire(previous);
            }
            log.info("Created connection {}", key);
            attempt.complete(connection);
            return connection;
        } catch (RuntimeException e) {
            RemoteConnectionException failure = ConnectionFailureClassifier.toException(key, e);
            log.warn("Connect to {} failed [{}]: {}", key, failure.getFailure(), failure.getMessage());
            attempt.completeExceptionally(failure);
            throw failure;
        } finally {
            inFlight.remove(key, attempt);
        }
    }

    private PooledConnection await(ConnectionKey key, CompletableFuture<PooledConnection> attempt) {
        try {
            return attempt.get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw ConnectionFailureClassifier.toException(key, e.getCause());
        } catch (TimeoutException e) {
            throw ConnectionFailureClassifier.toException(key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteConnectionException(ConnectionFailure.GENERIC, "Interrupted while connecting to " + key, e);
        }
    }

    private boolean isAlive(PooledConnection connection) {
        try {
            CommandResult result = connection.getSession().exec("echo test", livenessTimeout);
            return result.success();
        } catch (RuntimeException e) {
            log.debug("Liveness check failed for {}: {}", connection.getKey(), e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Channels
    // ------------------------------------------------------------------

    public InteractiveChannel openInteractiveChannel(RemoteTarget target, int cols, int rows) {
        return withReservedChannel(target, connection -> {
            try {
                InteractiveShell shell = connection.getSession().openShell(cols, rows);
                return new InteractiveChannel(connection, shell);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, false);
    }

    /**
     * Runs {@code work} against a session while holding one channel slot on it. Used for
     * script runs, which open several exec and file channels in sequence.
     */
    public <T> T withSession(RemoteTarget target, Function<RemoteSession, T> work) {
        return withReservedChannel(target, connection -> work.apply(connection.getSession()), true);
    }

    private <T> T withReservedChannel(RemoteTarget target, Function<PooledConnection, T> work, boolean releaseAfter) {
        ConnectionKey key = target.key();
        RuntimeException lastError = null;
        for (int attempt = 0; attempt < 2; attempt++) {
            PooledConnection connection = acquire(target, attempt > 0);
            if (!connection.tryReserveChannel(maxChannelsPerConnection)) {
                log.info("Channel limit reached for {} ({}/{} channels), forcing new connection",
                        key, connection.getOpenChannels(), maxChannelsPerConnection);
                retire(connection);
                continue;
            }
            boolean keepReservation = false;
            try {
                connection.touch();
                T result = work.apply(connection);
                keepReservation = !releaseAfter;
                return result;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                lastError = ConnectionFailureClassifier.toException(key, cause);
                log.warn("Channel open failed on {}, retrying on a fresh connection: {}", key, cause.getMessage());
                retire(connection);
            } finally {
                if (!keepReservation) connection.releaseChannel();
                connection.touch();
            }
        }
        if (lastError != null) throw lastError;
        throw new RemoteConnectionException(ConnectionFailure.CHANNEL_LIMIT, ConnectionFailure.CHANNEL_LIMIT.describe(key));
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    public CommandResult execute(RemoteTarget target, String command) {
        return execute(target, command, null, livenessTimeout.multipliedBy(12));
    }

    /**
     * Runs {@code command} under the user's login shell. Connection problems come back as stderr;
     * the connection stays pooled after the command.
     */
    public CommandResult execute(RemoteTarget target, String command, String workingDirectory, Duration timeout) {
        try {
            PooledConnection connection = acquire(target, false);
            String shell = defaultShell(connection);
            String line = workingDirectory == null || workingDirectory.isBlank()
                    ? command
                    : "cd " + PosixShell.quote(workingDirectory) + " && " + command;
            CommandResult result = connection.getSession().exec(PosixShell.command(shell, "-c", line), timeout);
            connection.touch();
            return result;
        } catch (RemoteConnectionException e) {
            return CommandResult.failure(e.getMessage());
        }
    }

    String defaultShell(PooledConnection connection) {
        String cached = shellCache.get(connection.getKey());
        if (cached != null) return cached;

        String shell = FALLBACK_SHELL;
        try {
            CommandResult result = connection.getSession().exec("echo \"$SHELL\"", livenessTimeout);
            if (result.success() && result.stdout() != null && !result.stdout().isBlank()) {
                shell = result.stdout().trim();
            }
        } catch (RuntimeException e) {
            log.debug("Shell detection failed for {}, using {}", connection.getKey(), FALLBACK_SHELL);
        }
        String raced = shellCache.putIfAbsent(connection.getKey(), shell);
        return raced != null ? raced : shell;
    }

    public String shellPrompt(RemoteTarget target, String workingDirectory) {
        CommandResult pwd = execute(target, "pwd", workingDirectory, livenessTimeout);
        String cwd = pwd.success() ? pwd.stdout().trim() : workingDirectory;
        CommandResult ps1 = execute(target, "echo \"$PS1\"", workingDirectory, livenessTimeout);
        String raw = ps1.success() ? ps1.stdout() : null;
        return ShellPromptResolver.render(raw, target.user(), target.host(), cwd);
    }

    // ------------------------------------------------------------------
    // Utilities
    // ------------------------------------------------------------------

    public ConnectionTestResponse testConnection(RemoteTarget target) {
        try {
            RemoteSession session = transport.connect(target, connectTimeout);
            session.close();
            return new ConnectionTestResponse(true, "Successfully connected to " + target.key());
        } catch (RuntimeException e) {
            RemoteConnectionException failure = ConnectionFailureClassifier.toException(target.key(), e);
            return new ConnectionTestResponse(false, failure.getMessage());
        }
    }

    public void prewarm(RemoteTarget target) {
        try {
            acquire(target, false);
        } catch (RemoteConnectionException e) {
            log.warn("Prewarm of {} failed: {}", target.key(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Eviction
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${javacron.remote.sweep-interval-ms:120000}")
    public void sweepIdle() {
        Instant cutoff = Instant.now().minus(idleTimeout);
        List<PooledConnection> idle = new ArrayList<>();
        for (PooledConnection connection : connections.values()) {
            if (connection.getLastUsedAt().isBefore(cutoff) && connection.getOpenChannels() == 0) {
                idle.add(connection);
            }
        }
        for (PooledConnection connection : idle) {
            log.info("Closing idle connection {}", connection.getKey());
            evict(connection);
        }
    }

    private void evict(PooledConnection connection) {
        connections.remove(connection.getKey(), connection);
        connection.markRetired();
        closeQuietly(connection);
    }

    void retire(PooledConnection connection) {
        connections.remove(connection.getKey(), connection);
        if (connection.markRetired()) {
            scheduleClose(connection, 1);
        }
    }

    private void scheduleClose(PooledConnection connection, int check) {
        housekeeping.schedule(() -> {
            if (connection.getOpenChannels() > 0 && check < MAX_RETIRE_CHECKS) {
                scheduleClose(connection, check + 1);
                return;
            }
            log.debug("Closing retired connection {}", connection.getKey());
            closeQuietly(connection);
        }, retireGrace.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void closeQuietly(PooledConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close connection {}: {}", connection.getKey(), e.getMessage());
        }
    }

    public int size() {
        return connections.size();
    }

    PooledConnection current(ConnectionKey key) {
        return connections.get(key);
    }

    @PreDestroy
    public void shutdown() {
        connections.values().forEach(this::closeQuietly);
        connections.clear();
        housekeeping.shutdownNow();
    }
}
