package io.github.drompincen.javacron.runtime.store;

import io.github.drompincen.javacron.persistence.document.ConditionalActionDocument;
import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.document.ExecutionLogDocument;
import io.github.drompincen.javacron.persistence.document.ServerDocument;
import io.github.drompincen.javacron.persistence.document.ToolCredentialDocument;
import io.github.drompincen.javacron.persistence.document.UserVariableDocument;
import io.github.drompincen.javacron.persistence.repository.ConditionalActionRepository;
import io.github.drompincen.javacron.persistence.repository.EventRepository;
import io.github.drompincen.javacron.persistence.repository.ExecutionLogRepository;
import io.github.drompincen.javacron.persistence.repository.ServerRepository;
import io.github.drompincen.javacron.persistence.repository.ToolCredentialRepository;
import io.github.drompincen.javacron.persistence.repository.UserVariableRepository;
import io.github.drompincen.javacron.protocol.api.EventStatus;
import io.github.drompincen.javacron.protocol.api.TriggerKind;
import com.mongodb.client.result.UpdateResult;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class MongoEventStore implements EventStore {

    private final EventRepository eventRepository;
    private final ConditionalActionRepository actionRepository;
    private final ExecutionLogRepository logRepository;
    private final UserVariableRepository variableRepository;
    private final ServerRepository serverRepository;
    private final ToolCredentialRepository toolCredentialRepository;
    private final MongoTemplate mongoTemplate;

    public MongoEventStore(EventRepository eventRepository,
                           ConditionalActionRepository actionRepository,
                           ExecutionLogRepository logRepository,
                           UserVariableRepository variableRepository,
                           ServerRepository serverRepository,
                           ToolCredentialRepository toolCredentialRepository,
                           MongoTemplate mongoTemplate) {
        this.eventRepository = eventRepository;
        this.actionRepository = actionRepository;
        this.logRepository = logRepository;
        this.variableRepository = variableRepository;
        this.serverRepository = serverRepository;
        this.toolCredentialRepository = toolCredentialRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<EventDocument> findActiveEvents() {
        return eventRepository.findByStatus(EventStatus.ACTIVE);
    }

    @Override
    public Optional<EventDocument> findEvent(String eventId) {
        return eventRepository.findById(eventId);
    }

    @Override
    public Optional<EventDocument> recordRun(String eventId, boolean succeeded, Instant finishedAt) {
        Update update = new Update()
                .inc("executionCount", 1)
                .inc(succeeded ? "successCount" : "failureCount", 1)
                .set("lastRunAt", finishedAt)
                .set("updatedAt", finishedAt);
        return Optional.ofNullable(mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(eventId)), update,
                FindAndModifyOptions.options().returnNew(true), EventDocument.class));
    }

    @Override
    public boolean pauseIfActive(String eventId) {
        UpdateResult result = mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(eventId).and("status").is(EventStatus.ACTIVE)),
                new Update().set("status", EventStatus.PAUSED).set("updatedAt", Instant.now()),
                EventDocument.class);
        return result.getModifiedCount() > 0;
    }

    @Override
    public void updateNextRunAt(String eventId, Instant nextRunAt) {
        // Targeted update so a concurrent edit of the event is not overwritten.
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(eventId)),
                new Update().set("nextRunAt", nextRunAt), EventDocument.class);
    }

    @Override
    public List<ConditionalActionDocument> findActions(String eventId, TriggerKind kind) {
        return switch (kind) {
            case SUCCESS -> actionRepository.findBySuccessEventIdOrderByCreatedAtAsc(eventId);
            case FAILURE -> actionRepository.findByFailEventIdOrderByCreatedAtAsc(eventId);
            case ALWAYS -> actionRepository.findByAlwaysEventIdOrderByCreatedAtAsc(eventId);
            case CONDITION -> actionRepository.findByConditionEventIdOrderByCreatedAtAsc(eventId);
        };
    }

    @Override
    public Map<String, String> getUserVariables(String userId) {
        Map<String, String> variables = new LinkedHashMap<>();
        for (UserVariableDocument v : variableRepository.findByUserId(userId)) {
            variables.put(v.getKey(), v.getValue());
        }
        return variables;
    }

    @Override
    public void setUserVariable(String userId, String key, String value) {
        UserVariableDocument variable = variableRepository.findByUserIdAndKey(userId, key).orElseGet(() -> {
            UserVariableDocument created = new UserVariableDocument();
            created.setVariableId(UUID.randomUUID().toString());
            created.setUserId(userId);
            created.setKey(key);
            created.setCreatedAt(Instant.now());
            return created;
        });
        variable.setValue(value);
        variable.setUpdatedAt(Instant.now());
        variableRepository.save(variable);
    }

    @Override
    public void deleteUserVariable(String userId, String key) {
        variableRepository.deleteByUserIdAndKey(userId, key);
    }

    @Override
    public ExecutionLogDocument createLog(ExecutionLogDocument log) {
        if (log.getLogId() == null) {
            log.setLogId(UUID.randomUUID().toString());
        }
        return logRepository.save(log);
    }

    @Override
    public ExecutionLogDocument updateLog(ExecutionLogDocument log) {
        return logRepository.save(log);
    }

    @Override
    public void attachJobToLog(String logId, String jobId) {
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(logId)),
                new Update().set("jobId", jobId), ExecutionLogDocument.class);
    }

    @Override
    public Optional<ExecutionLogDocument> findLog(String logId) {
        return logRepository.findById(logId);
    }

    @Override
    public Optional<ExecutionLogDocument> findLatestLog(String eventId) {
        return logRepository.findFirstByEventIdOrderByStartTimeDesc(eventId);
    }

    @Override
    public Optional<ServerDocument> findServer(String serverId) {
        return serverRepository.findById(serverId);
    }

    @Override
    public Optional<ToolCredentialDocument> findToolCredential(String toolId) {
        return toolCredentialRepository.findById(toolId);
    }
}
