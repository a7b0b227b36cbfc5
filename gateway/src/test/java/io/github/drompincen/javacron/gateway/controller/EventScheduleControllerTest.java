package io.github.drompincen.javacron.gateway.controller;

import io.github.drompincen.javacron.protocol.api.ExecutionResult;
import io.github.drompincen.javacron.protocol.api.RunEventRequest;
import io.github.drompincen.javacron.protocol.api.ScheduleStatusResponse;
import io.github.drompincen.javacron.protocol.api.TriggeredBy;
import io.github.drompincen.javacron.runtime.scheduler.SchedulerService;
import io.github.drompincen.javacron.runtime.store.EventNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EventScheduleControllerTest {

    @Mock private SchedulerService schedulerService;

    private EventScheduleController controller;

    @BeforeEach
    void setUp() {
        controller = new EventScheduleController(schedulerService);
        when(schedulerService.runNow(eq("evt-1"), any(), anyMap(), anyBoolean()))
                .thenReturn(ExecutionResult.queued("job-1", 3));
        when(schedulerService.runNow(eq("missing"), any(), anyMap(), anyBoolean()))
                .thenThrow(new EventNotFoundException("missing"));
    }

    @Test
    void runWithoutBodyQueuesManualRun() {
        ResponseEntity<ExecutionResult> response = controller.run("evt-1", null);

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().jobId()).isEqualTo("job-1");
        verify(schedulerService).runNow("evt-1", TriggeredBy.MANUAL, Map.of(), false);
    }

    @Test
    void runPassesInputAndWaitFlag() {
        controller.run("evt-1", new RunEventRequest(Map.of("ticket", "OPS-1"), true));

        verify(schedulerService).runNow("evt-1", TriggeredBy.MANUAL, Map.of("ticket", "OPS-1"), true);
    }

    @Test
    void runOnMissingEventIs404() {
        ResponseEntity<ExecutionResult> response = controller.run("missing", null);

        assertThat(response.getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void rescheduleReturnsFreshStatus() {
        ScheduleStatusResponse status = new ScheduleStatusResponse("evt-1", true, false, null,
                Instant.parse("2026-05-01T00:00:00Z"));
        when(schedulerService.status("evt-1")).thenReturn(status);

        ResponseEntity<ScheduleStatusResponse> response = controller.reschedule("evt-1");

        verify(schedulerService).reschedule("evt-1");
        assertThat(response.getBody()).isEqualTo(status);
    }

    @Test
    void unscheduleIsNoContent() {
        assertThat(controller.unschedule("evt-1").getStatusCode().value()).isEqualTo(204);
        verify(schedulerService).unschedule("evt-1");
    }
}
