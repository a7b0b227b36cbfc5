package io.github.drompincen.javacron.runtime.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.document.ExecutionLogDocument;
import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.protocol.api.CadenceUnit;
import io.github.drompincen.javacron.protocol.api.EventStatus;
import io.github.drompincen.javacron.protocol.api.EventType;
import io.github.drompincen.javacron.protocol.api.ExecutionResult;
import io.github.drompincen.javacron.protocol.api.HttpRequestSpec;
import io.github.drompincen.javacron.protocol.api.JobType;
import io.github.drompincen.javacron.protocol.api.LogStatus;
import io.github.drompincen.javacron.protocol.api.TriggeredBy;
import io.github.drompincen.javacron.runtime.store.InMemoryEventStore;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExecutionLauncherTest {

    @Mock private JobPoller jobPoller;

    private InMemoryEventStore store;
    private InMemoryJobQueue queue;
    private ExecutionLauncher launcher;
    private EventDocument event;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        queue = new InMemoryJobQueue();
        launcher = new ExecutionLauncher(store, queue, jobPoller, new ObjectMapper());
        event = store.addEvent("evt-1", EventStatus.ACTIVE);
        event.setType(EventType.PYTHON);
        event.setContent("print('hi')");
        event.setServerId("srv-1");
        event.setEnvVars(Map.of("MODE", "prod"));
    }

    @Test
    void launchCreatesPendingLogAndQueuedJob() {
        ExecutionResult result = launcher.launch(event, TriggeredBy.MANUAL, Map.of("x", 1), false);

        assertThat(result.success()).isTrue();
        JobDocument job = queue.find(result.jobId()).orElseThrow();
        assertThat(job.getType()).isEqualTo(JobType.SCRIPT);
        assertThat(job.getPayload())
                .containsEntry(JobPayload.EVENT_ID, "evt-1")
                .containsEntry(JobPayload.EVENT_TYPE, "PYTHON")
                .containsEntry(JobPayload.CONTENT, "print('hi')")
                .containsEntry(JobPayload.SERVER_ID, "srv-1")
                .containsEntry(JobPayload.INPUT, Map.of("x", 1))
                .containsEntry(JobPayload.TIMEOUT_MS, 300_000L);
        assertThat(job.getMetadata()).containsEntry("triggeredBy", "MANUAL");

        ExecutionLogDocument log = store.logsFor("evt-1").get(0);
        assertThat(log.getStatus()).isEqualTo(LogStatus.PENDING);
        assertThat(log.getJobId()).isEqualTo(job.getJobId());
        assertThat(log.getTriggeredBy()).isEqualTo(TriggeredBy.MANUAL);
        assertThat(job.getPayload()).containsEntry(JobPayload.LOG_ID, log.getLogId());
        verifyNoInteractions(jobPoller);
    }

    @Test
    void httpEventCarriesRequestSpecAsMap() {
        event.setType(EventType.HTTP_REQUEST);
        event.setHttpRequest(new HttpRequestSpec("POST", "https://example.com/hook", Map.of("X-Key", "1"), "{}"));

        ExecutionResult result = launcher.launch(event, TriggeredBy.SCHEDULE, Map.of(), false);

        JobDocument job = queue.find(result.jobId()).orElseThrow();
        assertThat(job.getType()).isEqualTo(JobType.HTTP_REQUEST);
        assertThat(job.getPayload().get(JobPayload.HTTP_REQUEST))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("url", "https://example.com/hook");
    }

    @Test
    void waitingLaunchPollsWithTimeoutPlusPickupAllowance() {
        event.setTimeoutValue(2);
        event.setTimeoutUnit(CadenceUnit.MINUTES);
        when(jobPoller.waitForCompletion(any(), any(), any()))
                .thenReturn(new ExecutionResult(true, "done", 10L, null, true, "job"));

        ExecutionResult result = launcher.launch(event, TriggeredBy.WORKFLOW, Map.of(), true);

        assertThat(result.condition()).isTrue();
        verify(jobPoller).waitForCompletion(any(), eq(Duration.ofMinutes(2).plusSeconds(30)), eq(Duration.ofSeconds(1)));
    }

    @Test
    void queueFailureMarksLogFailed() {
        JobQueue broken = mock(JobQueue.class);
        when(broken.createJob(any())).thenThrow(new IllegalStateException("queue unavailable"));
        launcher = new ExecutionLauncher(store, broken, jobPoller, new ObjectMapper());

        ExecutionResult result = launcher.launch(event, TriggeredBy.SCHEDULE, Map.of(), false);

        assertThat(result.success()).isFalse();
        assertThat(result.output()).contains("queue unavailable");
        ExecutionLogDocument log = store.logsFor("evt-1").get(0);
        assertThat(log.getStatus()).isEqualTo(LogStatus.FAILURE);
        assertThat(log.getEndTime()).isNotNull();
    }

    @Test
    void timeoutDefaultsToFiveMinutes() {
        assertThat(ExecutionLauncher.timeoutFor(new EventDocument())).isEqualTo(Duration.ofMinutes(5));
        EventDocument e = new EventDocument();
        e.setTimeoutValue(45);
        e.setTimeoutUnit(CadenceUnit.SECONDS);
        assertThat(ExecutionLauncher.timeoutFor(e)).isEqualTo(Duration.ofSeconds(45));
    }
}
