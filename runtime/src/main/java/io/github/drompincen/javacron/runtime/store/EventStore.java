package io.github.drompincen.javacron.runtime.store;

import io.github.drompincen.javacron.persistence.document.ConditionalActionDocument;
import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.document.ExecutionLogDocument;
import io.github.drompincen.javacron.persistence.document.ServerDocument;
import io.github.drompincen.javacron.persistence.document.ToolCredentialDocument;
import io.github.drompincen.javacron.protocol.api.TriggerKind;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-through access to events and everything hanging off them. Nothing here is cached; every
 * call reflects the current stored state.
 */
public interface EventStore {

    List<EventDocument> findActiveEvents();

    Optional<EventDocument> findEvent(String eventId);

    /**
     * Counts one finished run in a single atomic update: execution count, success or failure count
     * and last run time. Returns the event as it stands after the update, empty when it is gone.
     */
    Optional<EventDocument> recordRun(String eventId, boolean succeeded, Instant finishedAt);

    /** Pauses the event only if it is still active. True when this call changed the status. */
    boolean pauseIfActive(String eventId);

    void updateNextRunAt(String eventId, Instant nextRunAt);

    /** Actions wired to {@code eventId} for one trigger kind, in creation order. */
    List<ConditionalActionDocument> findActions(String eventId, TriggerKind kind);

    Map<String, String> getUserVariables(String userId);

    void setUserVariable(String userId, String key, String value);

    void deleteUserVariable(String userId, String key);

    ExecutionLogDocument createLog(ExecutionLogDocument log);

    ExecutionLogDocument updateLog(ExecutionLogDocument log);

    /** Sets only the job id of a log, leaving a status a worker may already have written. */
    void attachJobToLog(String logId, String jobId);

    Optional<ExecutionLogDocument> findLog(String logId);

    Optional<ExecutionLogDocument> findLatestLog(String eventId);

    Optional<ServerDocument> findServer(String serverId);

    Optional<ToolCredentialDocument> findToolCredential(String toolId);
}
