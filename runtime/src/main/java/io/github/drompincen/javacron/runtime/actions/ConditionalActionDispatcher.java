package io.github.drompincen.javacron.runtime.actions;

import io.github.drompincen.javacron.persistence.document.ConditionalActionDocument;
import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.document.ExecutionLogDocument;
import io.github.drompincen.javacron.persistence.document.ServerDocument;
import io.github.drompincen.javacron.persistence.document.ToolCredentialDocument;
import io.github.drompincen.javacron.protocol.api.ConditionalActionType;
import io.github.drompincen.javacron.protocol.api.ExecutionResult;
import io.github.drompincen.javacron.protocol.api.ToolActionConfig;
import io.github.drompincen.javacron.protocol.api.TriggerKind;
import io.github.drompincen.javacron.protocol.api.TriggeredBy;
import io.github.drompincen.javacron.runtime.scheduler.SchedulerService;
import io.github.drompincen.javacron.runtime.store.EventStore;
import io.github.drompincen.javacron.runtime.tools.ToolAction;
import io.github.drompincen.javacron.runtime.tools.ToolActionExecutor;
import io.github.drompincen.javacron.runtime.tools.ToolActionRegistry;
import io.github.drompincen.javacron.runtime.tools.ToolExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the follow-up actions wired to one outcome of an event. Every action is handled on its
 * own: a failing action is logged and the rest of the set still runs.
 */
@Service
public class ConditionalActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ConditionalActionDispatcher.class);
    /** Field mapping for mail senders; a ToolAction of this type is registered through ServiceLoader. */
    private static final String EMAIL_TOOL = "email";

    private final EventStore eventStore;
    private final TemplateProcessor templateProcessor;
    private final ToolActionRegistry toolActionRegistry;
    private final ToolActionExecutor toolActionExecutor;
    private final SchedulerService schedulerService;

    public ConditionalActionDispatcher(EventStore eventStore,
                                       TemplateProcessor templateProcessor,
                                       ToolActionRegistry toolActionRegistry,
                                       ToolActionExecutor toolActionExecutor,
                                       SchedulerService schedulerService) {
        this.eventStore = eventStore;
        this.templateProcessor = templateProcessor;
        this.toolActionRegistry = toolActionRegistry;
        this.toolActionExecutor = toolActionExecutor;
        this.schedulerService = schedulerService;
    }

    /**
     * Fans out the {@code SUCCESS}, {@code FAILURE} or {@code ALWAYS} set.
     *
     * @param succeeded outcome of the run, used for the message status
     */
    public void dispatch(String eventId, TriggerKind kind, boolean succeeded) {
        if (kind == TriggerKind.CONDITION) {
            throw new IllegalArgumentException("Use dispatchCondition for condition actions");
        }
        try {
            Optional<EventDocument> event = eventStore.findEvent(eventId);
            if (event.isEmpty()) return;

            List<ConditionalActionDocument> actions = eventStore.findActions(eventId, kind);
            if (actions.isEmpty()) return;

            RunSnapshot run = latestRun(eventId, kind == TriggerKind.FAILURE);
            log.debug("Processing {} {} actions for event {}", actions.size(), kind, eventId);
            for (ConditionalActionDocument action : actions) {
                process(action, event.get(), succeeded, run);
            }
        } catch (RuntimeException e) {
            log.error("Error handling {} actions for event {}", kind, eventId, e);
        }
    }

    /** Fans out the {@code CONDITION} set, only when {@code condition} is true. */
    public void dispatchCondition(String eventId, boolean condition) {
        try {
            Optional<EventDocument> event = eventStore.findEvent(eventId);
            if (event.isEmpty()) return;

            List<ConditionalActionDocument> actions = eventStore.findActions(eventId, TriggerKind.CONDITION);
            log.info("Processing {} condition actions for event {} with condition: {}", actions.size(), eventId, condition);
            if (actions.isEmpty()) return;

            RunSnapshot run = latestRun(eventId, false);
            for (ConditionalActionDocument action : actions) {
                if (condition) {
                    process(action, event.get(), true, run);
                } else {
                    log.info("Skipping condition action {} for event {} (condition: false)", action.getActionId(), eventId);
                }
            }
        } catch (RuntimeException e) {
            log.error("Error handling condition actions for event {}", eventId, e);
        }
    }

    void process(ConditionalActionDocument action, EventDocument event, boolean succeeded, RunSnapshot run) {
        try {
            if (action.getType() == ConditionalActionType.SEND_MESSAGE) {
                sendMessage(action, event, succeeded, run);
            } else if (action.getType() == ConditionalActionType.SCRIPT) {
                runScript(action);
            } else {
                log.warn("Conditional action {} has no type", action.getActionId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing conditional action {} for event {}", action.getActionId(), event.getEventId(), e);
        }
    }

    // ------------------------------------------------------------------
    // sendMessage
    // ------------------------------------------------------------------

    private void sendMessage(ConditionalActionDocument action, EventDocument event, boolean succeeded, RunSnapshot run) {
        if (action.getMessage() == null || action.getMessage().isBlank()) {
            log.warn("Message action {} has no message", action.getActionId());
            return;
        }
        if (action.getToolId() == null) {
            log.error("No tool specified for message action {}", action.getActionId());
            return;
        }
        Optional<ToolCredentialDocument> tool = eventStore.findToolCredential(action.getToolId());
        if (tool.isEmpty() || tool.get().getType() == null) {
            log.error("Tool {} not found for message action {}", action.getToolId(), action.getActionId());
            return;
        }
        String toolType = tool.get().getType().toLowerCase(Locale.ROOT);
        Optional<ToolAction> sender = toolActionRegistry.messageActionFor(toolType);
        if (sender.isEmpty()) {
            log.error("Tool type {} does not support conditional actions", toolType);
            return;
        }

        TemplateContext context = templateContext(event, succeeded, run);
        String message = templateProcessor.processTemplate(action.getMessage(), context);

        Map<String, Object> parameters = new LinkedHashMap<>();
        if (action.getEmailAddresses() != null && !action.getEmailAddresses().isEmpty()) {
            parameters.put("to", action.getEmailAddresses());
            parameters.put("recipients", action.getEmailAddresses());
        }
        if (action.getEmailSubject() != null && !action.getEmailSubject().isBlank()) {
            parameters.put("subject", templateProcessor.processTemplate(action.getEmailSubject(), context));
        } else if (EMAIL_TOOL.equals(toolType)) {
            parameters.put("subject", "Event " + (succeeded ? "Success" : "Failure") + ": " + nullToEmpty(event.getName()));
        }
        parameters.put("message", message);
        if (EMAIL_TOOL.equals(toolType)) {
            parameters.put("body", message);
            parameters.put("isHtml", true);
        }

        ToolActionConfig config = new ToolActionConfig(toolType, sender.get().actionId(), action.getToolId(), parameters);
        ToolExecutionResult result = toolActionExecutor.execute(config, parameters, event.getEventId(), event.getUserId());
        if (result.success()) {
            log.info("Message action {} sent via {}", action.getActionId(), toolType);
        } else {
            log.error("Message action {} via {} failed: {}", action.getActionId(), toolType, result.stderr());
        }
    }

    TemplateContext templateContext(EventDocument event, boolean succeeded, RunSnapshot run) {
        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("id", event.getEventId());
        eventData.put("name", event.getName());
        eventData.put("status", succeeded ? "success" : "failure");
        eventData.put("executionTime", (run.executionTime() != null ? run.executionTime() : Instant.now()).toString());
        eventData.put("server", serverName(event));
        if (run.durationMs() != null) eventData.put("duration", run.durationMs());
        if (run.output() != null) eventData.put("output", run.output());
        if (run.error() != null) eventData.put("error", run.error());

        Map<String, String> variables = event.getUserId() == null ? Map.of() : eventStore.getUserVariables(event.getUserId());
        return new TemplateContext(eventData, variables, Map.of(), Map.of());
    }

    private String serverName(EventDocument event) {
        if (event.getServerId() == null) return "Local";
        return eventStore.findServer(event.getServerId())
                .map(ServerDocument::getName)
                .orElse(event.getServerId());
    }

    // ------------------------------------------------------------------
    // runScript
    // ------------------------------------------------------------------

    private void runScript(ConditionalActionDocument action) {
        String targetId = action.getTargetEventId();
        if (targetId == null) {
            log.warn("Script action {} has no target event", action.getActionId());
            return;
        }
        if (eventStore.findEvent(targetId).isEmpty()) {
            log.error("Target event {} not found", targetId);
            return;
        }
        log.info("Executing target event {} as a result of conditional action {}", targetId, action.getActionId());
        ExecutionResult result = schedulerService.runNow(targetId, TriggeredBy.CONDITIONAL_ACTION, Map.of(), false);
        log.info("Conditional run of event {} queued: {}", targetId, result.success());
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    private RunSnapshot latestRun(String eventId, boolean failure) {
        Optional<ExecutionLogDocument> latest = eventStore.findLatestLog(eventId);
        if (latest.isEmpty()) return RunSnapshot.EMPTY;
        ExecutionLogDocument logEntry = latest.get();
        String output = logEntry.getOutput() != null ? logEntry.getOutput() : "No output available";
        String error = logEntry.getError();
        if (failure && error == null) error = "Unknown error";
        return new RunSnapshot(logEntry.getStartTime(), logEntry.getDurationMs(), output, error);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    record RunSnapshot(Instant executionTime, Long durationMs, String output, String error) {
        static final RunSnapshot EMPTY = new RunSnapshot(null, null, null, null);
    }
}
