package io.github.drompincen.javacron.persistence.document;

import io.github.drompincen.javacron.protocol.api.EventType;
import io.github.drompincen.javacron.protocol.api.LogStatus;
import io.github.drompincen.javacron.protocol.api.TriggeredBy;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One record per run of an event, created PENDING before the job is enqueued.
 */
@Document(collection = "execution_logs")
@CompoundIndex(name = "event_start", def = "{'eventId': 1, 'startTime': -1}")
public class ExecutionLogDocument {

    @Id
    private String logId;
    private String eventId;
    private String eventName;
    private EventType eventType;
    private String userId;
    private LogStatus status;
    @Indexed(sparse = true)
    private String jobId;
    private TriggeredBy triggeredBy;
    private String workflowId;
    private Instant startTime;
    private Instant endTime;
    private Long durationMs;
    private String output;
    private String error;
    private Integer exitCode;

    public ExecutionLogDocument() {}

    public String getLogId() { return logId; }
    public void setLogId(String logId) { this.logId = logId; }
    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }
    public String getEventName() { return eventName; }
    public void setEventName(String eventName) { this.eventName = eventName; }
    public EventType getEventType() { return eventType; }
    public void setEventType(EventType eventType) { this.eventType = eventType; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public LogStatus getStatus() { return status; }
    public void setStatus(LogStatus status) { this.status = status; }
    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public TriggeredBy getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(TriggeredBy triggeredBy) { this.triggeredBy = triggeredBy; }
    public String getWorkflowId() { return workflowId; }
    public void setWorkflowId(String workflowId) { this.workflowId = workflowId; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public Long getDurationMs() { return durationMs; }
    public void setDurationMs(Long durationMs) { this.durationMs = durationMs; }
    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public Integer getExitCode() { return exitCode; }
    public void setExitCode(Integer exitCode) { this.exitCode = exitCode; }
}
