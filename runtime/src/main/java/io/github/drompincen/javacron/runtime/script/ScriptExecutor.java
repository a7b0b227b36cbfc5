package io.github.drompincen.javacron.runtime.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.runtime.remote.CommandResult;
import io.github.drompincen.javacron.runtime.remote.PosixShell;
import io.github.drompincen.javacron.runtime.remote.RemoteSession;
import io.github.drompincen.javacron.runtime.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one script through the work-directory protocol on any {@link RemoteSession}: stage the JSON
 * files and the shimmed script, run it, read back output, condition and variables, then remove
 * the directory whatever happened.
 */
@Service
public class ScriptExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScriptExecutor.class);
    private static final Duration HOUSEKEEPING_TIMEOUT = Duration.ofSeconds(30);

    private final EventStore eventStore;
    private final ObjectMapper objectMapper;

    public ScriptExecutor(EventStore eventStore, ObjectMapper objectMapper) {
        this.eventStore = eventStore;
        this.objectMapper = objectMapper;
    }

    public ScriptRunResult run(RemoteSession host, String baseDir, ScriptRunRequest request) {
        String workDir = baseDir + "/" + WorkDir.PREFIX + UUID.randomUUID();
        try {
            CommandResult mkdir = host.exec(PosixShell.command("mkdir", "-p", "-m", "700", workDir), HOUSEKEEPING_TIMEOUT);
            if (!mkdir.success()) {
                return ScriptRunResult.failure("Failed to create work directory " + workDir + ": " + mkdir.stderr());
            }

            Map<String, String> before = request.variables() == null ? Map.of() : request.variables();
            stage(host, workDir, request, before);

            CommandResult result = host.exec(
                    PosixShell.command("/bin/bash", workDir + "/" + WorkDir.RUNNER), request.timeout());

            JsonNode output = readJson(host, workDir, WorkDir.OUTPUT).orElse(null);
            Boolean condition = readCondition(host, workDir);
            VariableChanges changes = readVariables(host, workDir)
                    .map(after -> VariableDiff.between(before, after))
                    .orElse(VariableChanges.NONE);
            persistVariables(request.userId(), changes);

            return new ScriptRunResult(result.stdout(), result.stderr(), result.exitCode(),
                    result.timedOut(), output, condition, changes);
        } catch (IOException | RuntimeException e) {
            log.error("Script run in {} failed: {}", workDir, e.getMessage());
            return ScriptRunResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            cleanup(host, baseDir, workDir);
        }
    }

    private void stage(RemoteSession host, String workDir, ScriptRunRequest request,
                       Map<String, String> variables) throws IOException {
        Map<String, Object> input = request.input() == null ? Map.of() : request.input();
        Map<String, Object> event = request.event() == null ? Map.of() : request.event();
        Map<String, String> snapshot = new LinkedHashMap<>(variables);
        snapshot.put(WorkDir.UPDATED_KEY, Instant.now().toString());

        write(host, workDir, WorkDir.INPUT, json(input));
        write(host, workDir, WorkDir.EVENT, json(event));
        write(host, workDir, WorkDir.VARIABLES, json(snapshot));

        ShimLanguage language = request.language();
        write(host, workDir, language.scriptFile(), language.compose(request.content()));
        write(host, workDir, WorkDir.RUNNER, runner(workDir, language, request.environment()));
    }

    String runner(String workDir, ShimLanguage language, Map<String, String> environment) {
        StringBuilder sb = new StringBuilder("#!/bin/bash\n");
        sb.append("export ").append(WorkDir.DIR_ENV).append('=').append(PosixShell.quote(workDir)).append('\n');
        if (environment != null) {
            environment.forEach((name, value) -> {
                if (PosixShell.isValidEnvName(name)) {
                    sb.append("export ").append(name).append('=')
                            .append(PosixShell.quote(value == null ? "" : value)).append('\n');
                } else {
                    log.warn("Skipping invalid environment variable name '{}'", name);
                }
            });
        }
        sb.append("cd ").append(PosixShell.quote(workDir)).append(" || exit 1\n");
        sb.append("exec ").append(PosixShell.command(language.interpreter(), workDir + "/" + language.scriptFile()))
                .append('\n');
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Read-back
    // ------------------------------------------------------------------

    private Optional<JsonNode> readJson(RemoteSession host, String workDir, String name) {
        try {
            Optional<byte[]> bytes = host.readFile(workDir + "/" + name);
            if (bytes.isEmpty() || bytes.get().length == 0) return Optional.empty();
            return Optional.ofNullable(objectMapper.readTree(bytes.get()));
        } catch (IOException | RuntimeException e) {
            log.debug("No usable {} in {}: {}", name, workDir, e.getMessage());
            return Optional.empty();
        }
    }

    private Boolean readCondition(RemoteSession host, String workDir) {
        return readJson(host, workDir, WorkDir.CONDITION)
                .map(node -> node.get("condition"))
                .filter(JsonNode::isBoolean)
                .map(JsonNode::booleanValue)
                .orElse(null);
    }

    private Optional<Map<String, String>> readVariables(RemoteSession host, String workDir) {
        return readJson(host, workDir, WorkDir.VARIABLES)
                .filter(JsonNode::isObject)
                .map(node -> {
                    Map<String, String> values = new LinkedHashMap<>();
                    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        if (field.getValue() == null || field.getValue().isNull()) continue;
                        values.put(field.getKey(), field.getValue().isValueNode()
                                ? field.getValue().asText()
                                : field.getValue().toString());
                    }
                    return values;
                });
    }

    private void persistVariables(String userId, VariableChanges changes) {
        if (userId == null || changes.isEmpty()) return;
        changes.upserts().forEach((key, value) -> {
            try {
                eventStore.setUserVariable(userId, key, value);
            } catch (RuntimeException e) {
                log.warn("Failed to save variable '{}' for user {}: {}", key, userId, e.getMessage());
            }
        });
        for (String key : changes.deletions()) {
            try {
                eventStore.deleteUserVariable(userId, key);
            } catch (RuntimeException e) {
                log.warn("Failed to delete variable '{}' for user {}: {}", key, userId, e.getMessage());
            }
        }
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    private void cleanup(RemoteSession host, String baseDir, String workDir) {
        try {
            CommandResult rm = host.exec(PosixShell.command("rm", "-rf", workDir), HOUSEKEEPING_TIMEOUT);
            if (!rm.success()) {
                log.warn("Failed to remove work directory {}: {}", workDir, rm.stderr());
            }
            host.exec(PosixShell.command("find", baseDir, "-maxdepth", "1", "-type", "d",
                    "-name", WorkDir.PREFIX + "*", "-mmin", "+" + WorkDir.STALE_MINUTES,
                    "-exec", "rm", "-rf", "{}", "+"), HOUSEKEEPING_TIMEOUT);
        } catch (RuntimeException e) {
            log.warn("Work directory cleanup for {} failed: {}", workDir, e.getMessage());
        }
    }

    private void write(RemoteSession host, String workDir, String name, String content) throws IOException {
        host.writeFile(workDir + "/" + name, content.getBytes(StandardCharsets.UTF_8));
    }

    private String json(Object value) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
