package io.github.drompincen.javacron.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.persistence.document.ToolCredentialDocument;
import io.github.drompincen.javacron.protocol.api.ToolActionConfig;
import io.github.drompincen.javacron.runtime.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class ToolActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolActionExecutor.class);

    private final ToolActionRegistry registry;
    private final EventStore eventStore;
    private final ObjectMapper objectMapper;

    public ToolActionExecutor(ToolActionRegistry registry, EventStore eventStore, ObjectMapper objectMapper) {
        this.registry = registry;
        this.eventStore = eventStore;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs the configured action with {@code parameters} layered over the configured ones.
     * Failures are reported through the exit code, never thrown.
     */
    public ToolExecutionResult execute(ToolActionConfig config, Map<String, Object> parameters,
                                       String eventId, String userId) {
        if (config == null || config.toolType() == null || config.actionId() == null) {
            return ToolExecutionResult.failed("Tool action is not configured");
        }
        Optional<ToolAction> action = registry.get(config.toolType(), config.actionId());
        if (action.isEmpty()) {
            return ToolExecutionResult.failed("Unknown tool action " + config.toolType() + "/" + config.actionId());
        }

        Map<String, String> credentials = Map.of();
        if (config.toolId() != null) {
            Optional<ToolCredentialDocument> tool = eventStore.findToolCredential(config.toolId());
            if (tool.isEmpty()) {
                return ToolExecutionResult.failed("Tool " + config.toolId() + " not found");
            }
            if (userId != null && tool.get().getUserId() != null && !userId.equals(tool.get().getUserId())) {
                return ToolExecutionResult.failed("Tool " + config.toolId() + " does not belong to user " + userId);
            }
            credentials = tool.get().getCredentials() == null ? Map.of() : tool.get().getCredentials();
        }

        Map<String, Object> merged = new HashMap<>();
        if (config.parameters() != null) merged.putAll(config.parameters());
        if (parameters != null) merged.putAll(parameters);

        try {
            JsonNode input = objectMapper.valueToTree(merged);
            ToolActionResult result = action.get().execute(
                    new ToolActionContext(eventId, userId, config.toolId(), credentials), input);
            if (result.success()) {
                String stdout = result.output() == null ? "" : objectMapper.writeValueAsString(result.output());
                return new ToolExecutionResult(0, stdout, "");
            }
            return ToolExecutionResult.failed(result.error() == null ? "Tool action failed" : result.error());
        } catch (Exception e) {
            log.error("Tool action {}/{} threw: {}", config.toolType(), config.actionId(), e.getMessage());
            return ToolExecutionResult.failed(e.getMessage());
        }
    }
}
