package io.github.drompincen.javacron.runtime.jobs;

import io.github.drompincen.javacron.persistence.document.JobDocument;
import io.github.drompincen.javacron.runtime.execution.ExecutionRouter;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final JobQueue jobQueue;
    private final ExecutionRouter router;
    private final JobCompletionHandler completionHandler;
    private final int batchSize;
    private final int threads;
    private final ExecutorService executor;
    private final AtomicInteger busy = new AtomicInteger();
    private final String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    public JobWorker(JobQueue jobQueue,
                     ExecutionRouter router,
                     JobCompletionHandler completionHandler,
                     @Value("${javacron.worker.batch-size:10}") int batchSize,
                     @Value("${javacron.worker.threads:4}") int threads) {
        this.jobQueue = jobQueue;
        this.router = router;
        this.completionHandler = completionHandler;
        this.batchSize = batchSize;
        this.threads = threads;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Scheduled(fixedDelayString = "${javacron.worker.poll-interval-ms:1000}")
    public void poll() {
        int free = threads - busy.get();
        if (free <= 0) return;

        List<JobDocument> claimed;
        try {
            claimed = jobQueue.claimNext(Math.min(batchSize, free), workerId);
        } catch (RuntimeException e) {
            log.warn("Job claim failed: {}", e.getMessage());
            return;
        }
        for (JobDocument job : claimed) {
            busy.incrementAndGet();
            try {
                executor.execute(() -> {
                    try {
                        runJob(job);
                    } finally {
                        busy.decrementAndGet();
                    }
                });
            } catch (RejectedExecutionException e) {
                busy.decrementAndGet();
                log.error("Worker pool rejected job {}", job.getJobId());
                jobQueue.finish(job.getJobId(), JobOutcome.failure("Worker is shutting down"))
                        .ifPresent(completionHandler::onJobFinished);
            }
        }
    }

    /** Runs one claimed job to its terminal status. Never throws. */
    public void runJob(JobDocument job) {
        try {
            Optional<JobDocument> running = jobQueue.markRunning(job.getJobId());
            if (running.isEmpty()) {
                log.info("Job {} is no longer runnable, skipping", job.getJobId());
                return;
            }
            completionHandler.onJobStarted(running.get());

            JobOutcome outcome;
            try {
                outcome = router.execute(running.get());
            } catch (RuntimeException e) {
                log.error("Job {} failed unexpectedly", job.getJobId(), e);
                outcome = JobOutcome.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }

            jobQueue.finish(job.getJobId(), outcome).ifPresent(completionHandler::onJobFinished);
        } catch (RuntimeException e) {
            log.error("Error completing job {}", job.getJobId(), e);
        }
    }

    int busyWorkers() {
        return busy.get();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
