package io.github.drompincen.javacron.runtime.jobs;

import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.document.ExecutionLogDocument;
import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.protocol.api.JobStatus;
import io.github.drompincen.javacron.protocol.api.LogStatus;
import io.github.drompincen.javacron.protocol.api.TriggerKind;
import io.github.drompincen.javacron.runtime.actions.ConditionalActionDispatcher;
import io.github.drompincen.javacron.runtime.scheduler.SchedulerService;
import io.github.drompincen.javacron.runtime.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Records what a job did on its execution log and on the event, then fans out the event's
 * conditional actions.
 */
@Service
public class JobCompletionHandler {

    private static final Logger log = LoggerFactory.getLogger(JobCompletionHandler.class);
    static final int PARTIAL_EXIT_THRESHOLD = 100;

    private final EventStore eventStore;
    private final ConditionalActionDispatcher dispatcher;
    private final SchedulerService schedulerService;

    public JobCompletionHandler(EventStore eventStore,
                                ConditionalActionDispatcher dispatcher,
                                SchedulerService schedulerService) {
        this.eventStore = eventStore;
        this.dispatcher = dispatcher;
        this.schedulerService = schedulerService;
    }

    public void onJobStarted(JobDocument job) {
        findLog(job).ifPresent(entry -> {
            entry.setStatus(LogStatus.RUNNING);
            eventStore.updateLog(entry);
        });
    }

    public void onJobFinished(JobDocument job) {
        LogStatus status = logStatusFor(job);
        findLog(job).ifPresent(entry -> {
            Instant end = job.getCompletedAt() != null ? job.getCompletedAt() : Instant.now();
            entry.setStatus(status);
            entry.setEndTime(end);
            if (entry.getStartTime() != null) {
                entry.setDurationMs(Duration.between(entry.getStartTime(), end).toMillis());
            }
            entry.setOutput(job.getOutput());
            entry.setError(job.getError());
            entry.setExitCode(job.getExitCode());
            eventStore.updateLog(entry);
        });

        boolean succeeded = job.getStatus() == JobStatus.COMPLETED;
        updateEvent(job.getEventId(), succeeded);
        fanOut(job, succeeded);
        log.info("Job {} for event {} finished: {}", job.getJobId(), job.getEventId(), status);
    }

    static LogStatus logStatusFor(JobDocument job) {
        return switch (job.getStatus()) {
            case QUEUED, CLAIMED -> LogStatus.PENDING;
            case RUNNING -> LogStatus.RUNNING;
            case COMPLETED -> job.getExitCode() != null && job.getExitCode() >= PARTIAL_EXIT_THRESHOLD
                    ? LogStatus.PARTIAL : LogStatus.SUCCESS;
            case FAILED -> isTimeout(job) ? LogStatus.TIMEOUT : LogStatus.FAILURE;
            case CANCELLED -> LogStatus.FAILURE;
        };
    }

    private static boolean isTimeout(JobDocument job) {
        if (job.getExitCode() != null && job.getExitCode() == -1) return true;
        String error = job.getError() == null ? "" : job.getError().toLowerCase(Locale.ROOT);
        return error.contains("timeout") || error.contains("timed out");
    }

    private void updateEvent(String eventId, boolean succeeded) {
        try {
            Optional<EventDocument> counted = eventStore.recordRun(eventId, succeeded, Instant.now());
            if (counted.isEmpty()) return;
            EventDocument event = counted.get();

            boolean limitReached = event.getMaxExecutions() > 0
                    && event.getExecutionCount() >= event.getMaxExecutions();
            if (limitReached) {
                if (eventStore.pauseIfActive(eventId)) {
                    log.info("Event {} reached its execution limit of {}, pausing", eventId, event.getMaxExecutions());
                }
                schedulerService.unschedule(eventId);
            }
        } catch (RuntimeException e) {
            log.error("Failed to update counters for event {}", eventId, e);
        }
    }

    private void fanOut(JobDocument job, boolean succeeded) {
        String eventId = job.getEventId();
        dispatcher.dispatch(eventId, TriggerKind.ALWAYS, succeeded);
        dispatcher.dispatch(eventId, succeeded ? TriggerKind.SUCCESS : TriggerKind.FAILURE, succeeded);

        Map<String, Object> result = job.getResult() == null ? Map.of() : job.getResult();
        if (result.get(JobPayload.RESULT_CONDITION) instanceof Boolean condition) {
            dispatcher.dispatchCondition(eventId, condition);
        }
    }

    private Optional<ExecutionLogDocument> findLog(JobDocument job) {
        Object logId = job.getPayload() == null ? null : job.getPayload().get(JobPayload.LOG_ID);
        if (logId == null && job.getMetadata() != null) {
            logId = job.getMetadata().get("logId");
        }
        if (logId == null) {
            log.warn("Job {} carries no log id", job.getJobId());
            return Optional.empty();
        }
        return eventStore.findLog(logId.toString());
    }
}
