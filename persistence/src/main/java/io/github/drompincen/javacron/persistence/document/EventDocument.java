package io.github.drompincen.javacron.persistence.document;

import io.github.drompincen.javacron.protocol.api.CadenceUnit;
import io.github.drompincen.javacron.protocol.api.EventStatus;
import io.github.drompincen.javacron.protocol.api.EventType;
import io.github.drompincen.javacron.protocol.api.HttpRequestSpec;
import io.github.drompincen.javacron.protocol.api.ToolActionConfig;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * A user-defined unit of scheduled or on-demand work. The scheduler only ever writes
 * {@code nextRunAt}; counters are maintained by the job completion path.
 */
@Document(collection = "events")
public class EventDocument {

    @Id
    private String eventId;
    @Indexed
    private String userId;
    private String name;
    private EventType type;
    @Indexed
    private EventStatus status = EventStatus.DRAFT;

    // Cadence: either number + unit, or a raw cron expression
    private Integer scheduleNumber;
    private CadenceUnit scheduleUnit;
    private String customSchedule;
    private Instant startTime;

    // Target action
    private String content;
    private HttpRequestSpec httpRequest;
    private ToolActionConfig toolActionConfig;
    private Map<String, String> envVars;
    private Integer timeoutValue;
    private CadenceUnit timeoutUnit;

    // Remote binding; null runs locally
    private String serverId;

    private long executionCount;
    private long successCount;
    private long failureCount;
    private long maxExecutions;

    private Instant lastRunAt;
    private Instant nextRunAt;
    private Instant createdAt;
    private Instant updatedAt;

    public EventDocument() {}

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public EventType getType() { return type; }
    public void setType(EventType type) { this.type = type; }
    public EventStatus getStatus() { return status; }
    public void setStatus(EventStatus status) { this.status = status; }
    public Integer getScheduleNumber() { return scheduleNumber; }
    public void setScheduleNumber(Integer scheduleNumber) { this.scheduleNumber = scheduleNumber; }
    public CadenceUnit getScheduleUnit() { return scheduleUnit; }
    public void setScheduleUnit(CadenceUnit scheduleUnit) { this.scheduleUnit = scheduleUnit; }
    public String getCustomSchedule() { return customSchedule; }
    public void setCustomSchedule(String customSchedule) { this.customSchedule = customSchedule; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public HttpRequestSpec getHttpRequest() { return httpRequest; }
    public void setHttpRequest(HttpRequestSpec httpRequest) { this.httpRequest = httpRequest; }
    public ToolActionConfig getToolActionConfig() { return toolActionConfig; }
    public void setToolActionConfig(ToolActionConfig toolActionConfig) { this.toolActionConfig = toolActionConfig; }
    public Map<String, String> getEnvVars() { return envVars; }
    public void setEnvVars(Map<String, String> envVars) { this.envVars = envVars; }
    public Integer getTimeoutValue() { return timeoutValue; }
    public void setTimeoutValue(Integer timeoutValue) { this.timeoutValue = timeoutValue; }
    public CadenceUnit getTimeoutUnit() { return timeoutUnit; }
    public void setTimeoutUnit(CadenceUnit timeoutUnit) { this.timeoutUnit = timeoutUnit; }
    public String getServerId() { return serverId; }
    public void setServerId(String serverId) { this.serverId = serverId; }
    public long getExecutionCount() { return executionCount; }
    public void setExecutionCount(long executionCount) { this.executionCount = executionCount; }
    public long getSuccessCount() { return successCount; }
    public void setSuccessCount(long successCount) { this.successCount = successCount; }
    public long getFailureCount() { return failureCount; }
    public void setFailureCount(long failureCount) { this.failureCount = failureCount; }
    public long getMaxExecutions() { return maxExecutions; }
    public void setMaxExecutions(long maxExecutions) { this.maxExecutions = maxExecutions; }
    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }
    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
