package io.github.drompincen.javacron.runtime.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.document.ExecutionLogDocument;
import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.protocol.api.CadenceUnit;
import io.github.drompincen.javacron.protocol.api.ExecutionResult;
import io.github.drompincen.javacron.protocol.api.JobType;
import io.github.drompincen.javacron.protocol.api.LogStatus;
import io.github.drompincen.javacron.protocol.api.TriggeredBy;
import io.github.drompincen.javacron.runtime.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns one event run into a log record plus a queued job.
 */
@Service
public class ExecutionLauncher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLauncher.class);
    static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
    static final Duration POLL_INTERVAL = Duration.ofSeconds(1);
    // time a queued job may wait for a free worker before the run timeout starts counting
    static final Duration PICKUP_ALLOWANCE = Duration.ofSeconds(30);

    private final EventStore eventStore;
    private final JobQueue jobQueue;
    private final JobPoller jobPoller;
    private final ObjectMapper objectMapper;

    public ExecutionLauncher(EventStore eventStore, JobQueue jobQueue, JobPoller jobPoller, ObjectMapper objectMapper) {
        this.eventStore = eventStore;
        this.jobQueue = jobQueue;
        this.jobPoller = jobPoller;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the PENDING log, enqueues the job and writes the job id back onto the log. With
     * {@code waitForCompletion} the call blocks until the job ends or the event's timeout passes.
     */
    public ExecutionResult launch(EventDocument event, TriggeredBy triggeredBy,
                                  Map<String, Object> input, boolean waitForCompletion) {
        long started = System.currentTimeMillis();

        ExecutionLogDocument logEntry = new ExecutionLogDocument();
        logEntry.setEventId(event.getEventId());
        logEntry.setEventName(event.getName());
        logEntry.setEventType(event.getType());
        logEntry.setUserId(event.getUserId());
        logEntry.setStatus(LogStatus.PENDING);
        logEntry.setTriggeredBy(triggeredBy);
        logEntry.setStartTime(Instant.now());
        logEntry = eventStore.createLog(logEntry);

        try {
            JobDocument job = jobQueue.createJob(new JobRequest(
                    event.getEventId(),
                    event.getUserId(),
                    JobType.forEvent(event.getType()),
                    payload(event, logEntry.getLogId(), input),
                    Map.of("eventName", String.valueOf(event.getName()),
                            "triggeredBy", triggeredBy.name(),
                            "logId", logEntry.getLogId()),
                    JobDocument.PRIORITY_NORMAL));

            logEntry.setJobId(job.getJobId());
            eventStore.attachJobToLog(logEntry.getLogId(), job.getJobId());
            log.info("Queued job {} for event {} ({})", job.getJobId(), event.getEventId(), triggeredBy);

            if (!waitForCompletion) {
                return ExecutionResult.queued(job.getJobId(), System.currentTimeMillis() - started);
            }
            return jobPoller.waitForCompletion(job.getJobId(), timeoutFor(event).plus(PICKUP_ALLOWANCE), POLL_INTERVAL);
        } catch (RuntimeException e) {
            log.error("Failed to queue event {}: {}", event.getEventId(), e.getMessage());
            logEntry.setStatus(LogStatus.FAILURE);
            logEntry.setError(e.getMessage());
            logEntry.setEndTime(Instant.now());
            logEntry.setDurationMs(System.currentTimeMillis() - started);
            try {
                eventStore.updateLog(logEntry);
            } catch (RuntimeException updateError) {
                log.warn("Could not record failure on log {}: {}", logEntry.getLogId(), updateError.getMessage());
            }
            return ExecutionResult.failed(logEntry.getJobId(), e.getMessage(), System.currentTimeMillis() - started);
        }
    }

    Map<String, Object> payload(EventDocument event, String logId, Map<String, Object> input) {
        Map<String, Object> payload = new HashMap<>();
        payload.put(JobPayload.EVENT_ID, event.getEventId());
        payload.put(JobPayload.LOG_ID, logId);
        payload.put(JobPayload.EVENT_TYPE, event.getType() == null ? null : event.getType().name());
        payload.put(JobPayload.CONTENT, event.getContent());
        payload.put(JobPayload.INPUT, input == null ? Map.of() : input);
        payload.put(JobPayload.SERVER_ID, event.getServerId());
        payload.put(JobPayload.ENV_VARS, event.getEnvVars() == null ? Map.of() : event.getEnvVars());
        payload.put(JobPayload.TIMEOUT_MS, timeoutFor(event).toMillis());
        if (event.getHttpRequest() != null) {
            payload.put(JobPayload.HTTP_REQUEST, objectMapper.convertValue(event.getHttpRequest(), Map.class));
        }
        if (event.getToolActionConfig() != null) {
            payload.put(JobPayload.TOOL_ACTION, objectMapper.convertValue(event.getToolActionConfig(), Map.class));
        }
        return payload;
    }

    public static Duration timeoutFor(EventDocument event) {
        Integer value = event.getTimeoutValue();
        CadenceUnit unit = event.getTimeoutUnit();
        if (value == null || value <= 0 || unit == null) {
            return DEFAULT_TIMEOUT;
        }
        return switch (unit) {
            case SECONDS -> Duration.ofSeconds(value);
            case MINUTES -> Duration.ofMinutes(value);
            case HOURS -> Duration.ofHours(value);
            case DAYS -> Duration.ofDays(value);
        };
    }
}
