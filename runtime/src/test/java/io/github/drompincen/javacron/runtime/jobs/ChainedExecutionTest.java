package io.github.drompincen.javacron.runtime.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.javacron.persistence.document.ConditionalActionDocument;
import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.protocol.api.ConditionalActionType;
import io.github.drompincen.javacron.protocol.api.EventStatus;
import io.github.drompincen.javacron.protocol.api.EventType;
import io.github.drompincen.javacron.protocol.api.LogStatus;
import io.github.drompincen.javacron.protocol.api.TriggeredBy;
import io.github.drompincen.javacron.runtime.actions.ConditionalActionDispatcher;
import io.github.drompincen.javacron.runtime.actions.TemplateProcessor;
import io.github.drompincen.javacron.runtime.execution.ExecutionRouter;
import io.github.drompincen.javacron.runtime.scheduler.SchedulerService;
import io.github.drompincen.javacron.runtime.store.InMemoryEventStore;
import io.github.drompincen.javacron.runtime.tools.ToolActionExecutor;
import io.github.drompincen.javacron.runtime.tools.ToolActionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs events through queue, worker, completion and conditional actions with only the
 * execution itself stubbed.
 */
class ChainedExecutionTest {

    private InMemoryEventStore store;
    private InMemoryJobQueue queue;
    private ExecutionRouter router;
    private JobWorker worker;
    private SchedulerService scheduler;
    private final Map<String, JobOutcome> outcomes = new HashMap<>();
    private final List<String> executed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        queue = new InMemoryJobQueue();
        ObjectMapper mapper = new ObjectMapper();
        ExecutionLauncher launcher = new ExecutionLauncher(store, queue, new JobPoller(queue, mapper), mapper);
        scheduler = new SchedulerService(store, launcher, mock(TaskScheduler.class), Runnable::run, "UTC", 60_000);
        ConditionalActionDispatcher dispatcher = new ConditionalActionDispatcher(store,
                new TemplateProcessor(mapper), mock(ToolActionRegistry.class), mock(ToolActionExecutor.class), scheduler);
        JobCompletionHandler completionHandler = new JobCompletionHandler(store, dispatcher, scheduler);

        router = mock(ExecutionRouter.class);
        when(router.execute(any())).thenAnswer(inv -> {
            JobDocument job = inv.getArgument(0);
            executed.add(job.getEventId());
            return outcomes.getOrDefault(job.getEventId(), new JobOutcome(true, 0, "ok", "", null, null));
        });
        worker = new JobWorker(queue, router, completionHandler, 10, 1);
    }

    @AfterEach
    void tearDown() {
        worker.shutdown();
    }

    private EventDocument event(String id) {
        EventDocument event = store.addEvent(id, EventStatus.ACTIVE);
        event.setType(EventType.BASH);
        event.setContent("echo " + id);
        return event;
    }

    private void runScriptOn(String field, String sourceId, String targetId) {
        ConditionalActionDocument action = new ConditionalActionDocument();
        action.setType(ConditionalActionType.SCRIPT);
        action.setTargetEventId(targetId);
        switch (field) {
            case "success" -> action.setSuccessEventId(sourceId);
            case "failure" -> action.setFailEventId(sourceId);
            case "always" -> action.setAlwaysEventId(sourceId);
            default -> action.setConditionEventId(sourceId);
        }
        store.addAction(action);
    }

    private void drain() {
        for (int round = 0; round < 20; round++) {
            List<JobDocument> claimed = queue.claimNext(10, "test-worker");
            if (claimed.isEmpty()) return;
            claimed.forEach(worker::runJob);
        }
    }

    @Test
    void successChainRunsEachEventOnce() {
        event("a");
        event("b");
        event("c");
        runScriptOn("success", "a", "b");
        runScriptOn("success", "b", "c");

        scheduler.runNow("a");
        drain();

        assertThat(executed).containsExactly("a", "b", "c");
        assertThat(store.logsFor("b").get(0).getTriggeredBy()).isEqualTo(TriggeredBy.CONDITIONAL_ACTION);
        assertThat(store.logsFor("c").get(0).getStatus()).isEqualTo(LogStatus.SUCCESS);
        assertThat(store.events.get("c").getExecutionCount()).isEqualTo(1);
    }

    @Test
    void failureTakesFailureBranchOnly() {
        event("a");
        event("on-ok");
        event("on-fail");
        runScriptOn("success", "a", "on-ok");
        runScriptOn("failure", "a", "on-fail");
        outcomes.put("a", JobOutcome.failure("exit 3"));

        scheduler.runNow("a");
        drain();

        assertThat(executed).containsExactly("a", "on-fail");
        assertThat(store.logsFor("a").get(0).getStatus()).isEqualTo(LogStatus.FAILURE);
        assertThat(store.events.get("a").getFailureCount()).isEqualTo(1);
    }

    @Test
    void conditionActionsFollowScriptCondition() {
        event("a");
        event("b");
        runScriptOn("condition", "a", "b");
        outcomes.put("a", new JobOutcome(true, 0, "", "", null, false));

        scheduler.runNow("a");
        drain();
        assertThat(executed).containsExactly("a");

        outcomes.put("a", new JobOutcome(true, 0, "", "", null, true));
        scheduler.runNow("a");
        drain();
        assertThat(executed).containsExactly("a", "a", "b");
    }

    @Test
    void alwaysRunsAfterSuccessAndFailure() {
        event("a");
        event("cleanup");
        runScriptOn("always", "a", "cleanup");

        scheduler.runNow("a");
        drain();
        outcomes.put("a", JobOutcome.failure("boom"));
        scheduler.runNow("a");
        drain();

        assertThat(executed).containsExactly("a", "cleanup", "a", "cleanup");
    }

    @Test
    void deletedTargetIsSkipped() {
        event("a");
        runScriptOn("success", "a", "gone");

        scheduler.runNow("a");
        drain();

        assertThat(executed).containsExactly("a");
        assertThat(store.logsFor("a").get(0).getStatus()).isEqualTo(LogStatus.SUCCESS);
    }
}
