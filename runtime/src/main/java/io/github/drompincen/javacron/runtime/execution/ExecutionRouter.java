package io.github.drompincen.javacron.runtime.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.persistence.document.ServerDocument;
import io.github.drompincen.javacron.protocol.api.EventType;
import io.github.drompincen.javacron.protocol.api.HttpRequestSpec;
import io.github.drompincen.javacron.protocol.api.ToolActionConfig;
import io.github.drompincen.javacron.runtime.jobs.ExecutionLauncher;
import io.github.drompincen.javacron.runtime.jobs.JobOutcome;
import io.github.drompincen.javacron.runtime.jobs.JobPayload;
import io.github.drompincen.javacron.runtime.remote.ConnectionPool;
import io.github.drompincen.javacron.runtime.remote.LocalHost;
import io.github.drompincen.javacron.runtime.remote.RemoteConnectionException;
import io.github.drompincen.javacron.runtime.remote.RemoteSession;
import io.github.drompincen.javacron.runtime.remote.RemoteTarget;
import io.github.drompincen.javacron.runtime.script.ScriptExecutor;
import io.github.drompincen.javacron.runtime.script.ScriptRunRequest;
import io.github.drompincen.javacron.runtime.script.ScriptRunResult;
import io.github.drompincen.javacron.runtime.script.ShimLanguage;
import io.github.drompincen.javacron.runtime.store.EventStore;
import io.github.drompincen.javacron.runtime.tools.ToolActionExecutor;
import io.github.drompincen.javacron.runtime.tools.ToolExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides where a claimed job runs: scripts on their bound server (or locally when unbound),
 * HTTP requests through {@link HttpRequestRunner}, tool actions through the tool executor.
 */
@Service
public class ExecutionRouter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRouter.class);
    static final String REMOTE_WORK_ROOT = "/tmp";

    private final EventStore eventStore;
    private final ScriptExecutor scriptExecutor;
    private final ConnectionPool connectionPool;
    private final HttpRequestRunner httpRequestRunner;
    private final ToolActionExecutor toolActionExecutor;
    private final ObjectMapper objectMapper;
    private final RemoteSession localHost;
    private final String localWorkRoot;

    public ExecutionRouter(EventStore eventStore,
                           ScriptExecutor scriptExecutor,
                           ConnectionPool connectionPool,
                           HttpRequestRunner httpRequestRunner,
                           ToolActionExecutor toolActionExecutor,
                           ObjectMapper objectMapper,
                           @Value("${javacron.runner.local-work-root:${java.io.tmpdir}}") String localWorkRoot) {
        this(eventStore, scriptExecutor, connectionPool, httpRequestRunner, toolActionExecutor,
                objectMapper, new LocalHost(), localWorkRoot);
    }

    ExecutionRouter(EventStore eventStore, ScriptExecutor scriptExecutor, ConnectionPool connectionPool,
                    HttpRequestRunner httpRequestRunner, ToolActionExecutor toolActionExecutor,
                    ObjectMapper objectMapper, RemoteSession localHost, String localWorkRoot) {
        this.eventStore = eventStore;
        this.scriptExecutor = scriptExecutor;
        this.connectionPool = connectionPool;
        this.httpRequestRunner = httpRequestRunner;
        this.toolActionExecutor = toolActionExecutor;
        this.objectMapper = objectMapper;
        this.localHost = localHost;
        this.localWorkRoot = localWorkRoot.endsWith("/") && localWorkRoot.length() > 1
                ? localWorkRoot.substring(0, localWorkRoot.length() - 1)
                : localWorkRoot;
    }

    public JobOutcome execute(JobDocument job) {
        Map<String, Object> payload = job.getPayload() == null ? Map.of() : job.getPayload();
        String eventId = (String) payload.getOrDefault(JobPayload.EVENT_ID, job.getEventId());
        Optional<EventDocument> event = eventStore.findEvent(eventId);
        if (event.isEmpty()) {
            return JobOutcome.failure("Event " + eventId + " not found");
        }

        return switch (job.getType()) {
            case SCRIPT -> runScript(event.get(), payload);
            case HTTP_REQUEST -> runHttp(event.get(), payload);
            case TOOL_ACTION -> runToolAction(event.get(), payload);
        };
    }

    // ------------------------------------------------------------------
    // Scripts
    // ------------------------------------------------------------------

    private JobOutcome runScript(EventDocument event, Map<String, Object> payload) {
        EventType type = payload.get(JobPayload.EVENT_TYPE) != null
                ? EventType.valueOf((String) payload.get(JobPayload.EVENT_TYPE))
                : event.getType();
        if (type == null || !type.isScript()) {
            return JobOutcome.failure("Event " + event.getEventId() + " is not a script event");
        }

        String serverId = (String) payload.get(JobPayload.SERVER_ID);
        Optional<ServerDocument> server = Optional.empty();
        if (serverId != null) {
            server = eventStore.findServer(serverId);
            if (server.isEmpty()) {
                return JobOutcome.failure("Server " + serverId + " not found");
            }
        }

        ScriptRunRequest request = new ScriptRunRequest(
                event.getUserId(),
                ShimLanguage.forEvent(type),
                (String) payload.getOrDefault(JobPayload.CONTENT, event.getContent()),
                mapOf(payload.get(JobPayload.INPUT)),
                eventMetadata(event, server),
                event.getUserId() == null ? Map.of() : eventStore.getUserVariables(event.getUserId()),
                stringMapOf(payload.get(JobPayload.ENV_VARS)),
                timeout(payload, event));

        ScriptRunResult result;
        if (server.isEmpty()) {
            log.debug("Running event {} locally", event.getEventId());
            result = scriptExecutor.run(localHost, localWorkRoot, request);
        } else {
            RemoteTarget target = RemoteTarget.forServer(server.get());
            log.debug("Running event {} on {}", event.getEventId(), target.key());
            try {
                result = connectionPool.withSession(target, session -> scriptExecutor.run(session, REMOTE_WORK_ROOT, request));
            } catch (RemoteConnectionException e) {
                return JobOutcome.failure(e.getMessage());
            }
        }
        return toOutcome(result);
    }

    static JobOutcome toOutcome(ScriptRunResult result) {
        Integer exitCode = result.timedOut() ? Integer.valueOf(-1) : result.exitCode();
        String stderr = result.stderr() == null ? "" : result.stderr();
        if (result.timedOut() && !stderr.toLowerCase().contains("timed out")) {
            stderr = stderr + "Execution timed out";
        }
        return new JobOutcome(result.success(), exitCode == null ? Integer.valueOf(1) : exitCode,
                result.stdout(), stderr, result.output(), result.condition());
    }

    private Map<String, Object> eventMetadata(EventDocument event, Optional<ServerDocument> server) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("id", event.getEventId());
        metadata.put("name", event.getName());
        metadata.put("status", event.getStatus() == null ? null : event.getStatus().name().toLowerCase());
        metadata.put("executionTime", Instant.now().toString());
        metadata.put("server", server.map(ServerDocument::getName).orElse("Local"));
        return metadata;
    }

    // ------------------------------------------------------------------
    // HTTP and tool actions
    // ------------------------------------------------------------------

    private JobOutcome runHttp(EventDocument event, Map<String, Object> payload) {
        Object raw = payload.get(JobPayload.HTTP_REQUEST);
        HttpRequestSpec spec = raw != null
                ? objectMapper.convertValue(raw, HttpRequestSpec.class)
                : event.getHttpRequest();
        return httpRequestRunner.execute(spec, timeout(payload, event));
    }

    private JobOutcome runToolAction(EventDocument event, Map<String, Object> payload) {
        Object raw = payload.get(JobPayload.TOOL_ACTION);
        ToolActionConfig config = raw != null
                ? objectMapper.convertValue(raw, ToolActionConfig.class)
                : event.getToolActionConfig();
        if (config == null) {
            return JobOutcome.failure("Event " + event.getEventId() + " has no tool action configured");
        }
        ToolExecutionResult result = toolActionExecutor.execute(config, config.parameters(),
                event.getEventId(), event.getUserId());
        return new JobOutcome(result.success(), result.exitCode(), result.stdout(), result.stderr(), null, null);
    }

    private static Duration timeout(Map<String, Object> payload, EventDocument event) {
        Object raw = payload.get(JobPayload.TIMEOUT_MS);
        if (raw instanceof Number n && n.longValue() > 0) {
            return Duration.ofMillis(n.longValue());
        }
        return ExecutionLauncher.timeoutFor(event);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapOf(Object raw) {
        return raw instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static Map<String, String> stringMapOf(Object raw) {
        Map<String, String> result = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), v == null ? "" : String.valueOf(v)));
        }
        return result;
    }
}
