package io.github.drompincen.javacron.persistence.document;

import io.github.drompincen.javacron.protocol.api.ConditionalActionType;
import io.github.drompincen.javacron.protocol.api.TriggerKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Follow-up action wired to exactly one outcome of one event. Exactly one of the four
 * trigger foreign keys is set.
 */
@Document(collection = "conditional_actions")
public class ConditionalActionDocument {

    @Id
    private String actionId;
    private ConditionalActionType type;

    @Indexed(sparse = true)
    private String successEventId;
    @Indexed(sparse = true)
    private String failEventId;
    @Indexed(sparse = true)
    private String alwaysEventId;
    @Indexed(sparse = true)
    private String conditionEventId;

    // SCRIPT
    private String targetEventId;

    // SEND_MESSAGE
    private String toolId;
    private String message;
    private List<String> emailAddresses;
    private String emailSubject;

    private Instant createdAt;

    public ConditionalActionDocument() {}

    public TriggerKind getTriggerKind() {
        if (successEventId != null) return TriggerKind.SUCCESS;
        if (failEventId != null) return TriggerKind.FAILURE;
        if (alwaysEventId != null) return TriggerKind.ALWAYS;
        if (conditionEventId != null) return TriggerKind.CONDITION;
        return null;
    }

    public String getActionId() { return actionId; }
    public void setActionId(String actionId) { this.actionId = actionId; }
    public ConditionalActionType getType() { return type; }
    public void setType(ConditionalActionType type) { this.type = type; }
    public String getSuccessEventId() { return successEventId; }
    public void setSuccessEventId(String successEventId) { this.successEventId = successEventId; }
    public String getFailEventId() { return failEventId; }
    public void setFailEventId(String failEventId) { this.failEventId = failEventId; }
    public String getAlwaysEventId() { return alwaysEventId; }
    public void setAlwaysEventId(String alwaysEventId) { this.alwaysEventId = alwaysEventId; }
    public String getConditionEventId() { return conditionEventId; }
    public void setConditionEventId(String conditionEventId) { this.conditionEventId = conditionEventId; }
    public String getTargetEventId() { return targetEventId; }
    public void setTargetEventId(String targetEventId) { this.targetEventId = targetEventId; }
    public String getToolId() { return toolId; }
    public void setToolId(String toolId) { this.toolId = toolId; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public List<String> getEmailAddresses() { return emailAddresses; }
    public void setEmailAddresses(List<String> emailAddresses) { this.emailAddresses = emailAddresses; }
    public String getEmailSubject() { return emailSubject; }
    public void setEmailSubject(String emailSubject) { this.emailSubject = emailSubject; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
