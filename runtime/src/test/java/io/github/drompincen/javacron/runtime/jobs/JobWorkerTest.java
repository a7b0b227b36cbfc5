package io.github.drompincen.javacron.runtime.jobs;

import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.protocol.api.JobStatus;
import io.github.drompincen.javacron.protocol.api.JobType;
import io.github.drompincen.javacron.runtime.execution.ExecutionRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JobWorkerTest {

    @Mock private ExecutionRouter router;
    @Mock private JobCompletionHandler completionHandler;
    @Captor private ArgumentCaptor<JobDocument> finishedCaptor;

    private InMemoryJobQueue queue;
    private JobWorker worker;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue();
        worker = new JobWorker(queue, router, completionHandler, 10, 2);
    }

    @AfterEach
    void tearDown() {
        worker.shutdown();
    }

    private JobDocument enqueue(String eventId) {
        return queue.createJob(new JobRequest(eventId, "user-1", JobType.SCRIPT, Map.of(), Map.of(), 5));
    }

    @Test
    void runJobRecordsSuccessfulOutcome() {
        JobDocument job = enqueue("evt-1");
        when(router.execute(any())).thenReturn(new JobOutcome(true, 0, "hello", "", null, true));

        worker.runJob(job);

        JobDocument saved = queue.find(job.getJobId()).orElseThrow();
        assertThat(saved.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(saved.getOutput()).isEqualTo("hello");
        assertThat(saved.getResult()).containsEntry(JobPayload.RESULT_CONDITION, true);
        verify(completionHandler).onJobStarted(any());
        verify(completionHandler).onJobFinished(finishedCaptor.capture());
        assertThat(finishedCaptor.getValue().getJobId()).isEqualTo(job.getJobId());
    }

    @Test
    void routerExceptionBecomesFailedJob() {
        JobDocument job = enqueue("evt-1");
        when(router.execute(any())).thenThrow(new IllegalStateException("no route"));

        worker.runJob(job);

        JobDocument saved = queue.find(job.getJobId()).orElseThrow();
        assertThat(saved.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(saved.getError()).isEqualTo("no route");
        verify(completionHandler).onJobFinished(any());
    }

    @Test
    void cancelledJobIsNotRun() {
        JobDocument job = enqueue("evt-1");
        queue.cancel(job.getJobId());

        worker.runJob(job);

        verifyNoInteractions(router);
        verify(completionHandler, never()).onJobStarted(any());
        assertThat(queue.find(job.getJobId()).orElseThrow().getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void completionHandlerFailureDoesNotEscape() {
        JobDocument job = enqueue("evt-1");
        when(router.execute(any())).thenReturn(new JobOutcome(true, 0, "", "", null, null));
        doThrow(new RuntimeException("store down")).when(completionHandler).onJobFinished(any());

        worker.runJob(job);

        assertThat(queue.find(job.getJobId()).orElseThrow().getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void pollClaimsNoMoreThanFreeThreads() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);
        when(router.execute(any())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new JobOutcome(true, 0, "", "", null, null);
        });
        enqueue("a");
        enqueue("b");
        enqueue("c");

        worker.poll();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        worker.poll();

        assertThat(queue.jobs.values()).filteredOn(j -> j.getStatus() == JobStatus.QUEUED).hasSize(1);
        assertThat(worker.busyWorkers()).isEqualTo(2);

        release.countDown();
        worker.shutdown();
        assertThat(queue.jobs.values()).filteredOn(j -> j.getStatus() == JobStatus.COMPLETED).hasSize(2);
    }
}
