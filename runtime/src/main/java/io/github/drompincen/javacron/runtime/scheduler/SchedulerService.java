package io.github.drompincen.javacron.runtime.scheduler;

import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.protocol.api.EventStatus;
import io.github.drompincen.javacron.protocol.api.ExecutionResult;
import io.github.drompincen.javacron.protocol.api.ScheduleStatusResponse;
import io.github.drompincen.javacron.protocol.api.TriggeredBy;
import io.github.drompincen.javacron.runtime.jobs.ExecutionLauncher;
import io.github.drompincen.javacron.runtime.store.EventNotFoundException;
import io.github.drompincen.javacron.runtime.store.EventStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns one timer per active event and turns each accepted fire into a run.
 *
 * <p>Per event id: at most one registry entry, at most one {@code schedule} call in progress, and
 * at most one scheduled run executing. A fire is dropped when the event is already executing or
 * when it arrives sooner after the previous accepted fire than the cadence allows. The timer thread
 * claims the executing guard before handing a fire to the fire pool, so fires are never queued
 * behind a running one.
 */
@Service
public class SchedulerService {

    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    private final EventStore eventStore;
    private final ExecutionLauncher launcher;
    private final TaskScheduler taskScheduler;
    private final Executor fireExecutor;
    private final ZoneId zone;
    private final Duration reinitCooldown;

    private final Map<String, JobRegistryEntry> registry = new ConcurrentHashMap<>();
    private final Set<String> executing = ConcurrentHashMap.newKeySet();
    private final Set<String> scheduling = ConcurrentHashMap.newKeySet();

    private volatile Instant lastInitializedAt;
    private volatile boolean shutdownHookRegistered;

    public SchedulerService(EventStore eventStore,
                            ExecutionLauncher launcher,
                            TaskScheduler taskScheduler,
                            @Qualifier("fireExecutor") Executor fireExecutor,
                            @Value("${javacron.scheduler.zone:UTC}") String zone,
                            @Value("${javacron.scheduler.reinit-cooldown-ms:60000}") long reinitCooldownMs) {
        this.eventStore = eventStore;
        this.launcher = launcher;
        this.taskScheduler = taskScheduler;
        this.fireExecutor = fireExecutor;
        this.zone = ZoneId.of(zone);
        this.reinitCooldown = Duration.ofMillis(reinitCooldownMs);
    }

    // ------------------------------------------------------------------
    // Bootstrap
    // ------------------------------------------------------------------

    /**
     * Cancels every timer and schedules all active events again. A second call within the
     * cool-down window of a successful one does nothing. Storage failures propagate.
     */
    public synchronized void initialize() {
        Instant now = Instant.now();
        if (lastInitializedAt != null && Duration.between(lastInitializedAt, now).compareTo(reinitCooldown) < 0) {
            log.debug("Scheduler initialized {} ago, skipping", Duration.between(lastInitializedAt, now));
            return;
        }

        cancelAll();
        executing.clear();
        scheduling.clear();

        List<EventDocument> events = eventStore.findActiveEvents();
        log.info("Initializing scheduler with {} active events", events.size());
        for (EventDocument event : events) {
            schedule(event);
        }

        if (!shutdownHookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::cancelAll, "scheduler-shutdown"));
            shutdownHookRegistered = true;
        }
        lastInitializedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    public void schedule(EventDocument event) {
        String eventId = event.getEventId();
        if (!scheduling.add(eventId)) {
            log.warn("Schedule for event {} already in progress, ignoring", eventId);
            return;
        }
        try {
            JobRegistryEntry existing = registry.get(eventId);
            if (existing != null) {
                existing.cancel();
            }
            if (event.getStatus() != EventStatus.ACTIVE) {
                if (existing != null) registry.remove(eventId, existing);
                log.debug("Event {} is {}, not scheduling", eventId, event.getStatus());
                return;
            }

            Instant startTime = event.getStartTime();
            if (startTime != null && startTime.isAfter(Instant.now())) {
                JobRegistryEntry pending = new JobRegistryEntry(null, CadenceRules.minimumInterval(event));
                if (existing != null) {
                    pending.markFired(existing.lastFireTime());
                }
                registry.put(eventId, pending);
                pending.setHandle(taskScheduler.schedule(
                        () -> handOff(eventId, pending, () -> runStartTime(eventId, pending)), startTime));
                writeNextRunAt(eventId, startTime);
                log.info("Event {} will start at {}", eventId, startTime);
            } else {
                installRecurringRule(event);
            }
        } catch (UnsupportedCadenceException e) {
            dropCancelled(eventId);
            log.error("Cannot schedule event {}: {}", eventId, e.getMessage());
        } catch (RuntimeException e) {
            dropCancelled(eventId);
            log.error("Failed to schedule event {}", eventId, e);
        } finally {
            scheduling.remove(eventId);
        }
    }

    private void dropCancelled(String eventId) {
        JobRegistryEntry entry = registry.get(eventId);
        if (entry != null && entry.isCancelled()) {
            registry.remove(eventId, entry);
        }
    }

    /** Binds the event's recurring rule, replacing whatever timer the event had. */
    public void installRecurringRule(EventDocument event) {
        String eventId = event.getEventId();
        RecurrenceRule rule = CadenceRules.ruleFor(event);
        JobRegistryEntry entry = new JobRegistryEntry(rule, CadenceRules.minimumInterval(event));

        JobRegistryEntry previous = registry.put(eventId, entry);
        if (previous != null) {
            entry.markFired(previous.lastFireTime());
            previous.cancel();
        }

        ScheduledFuture<?> handle = taskScheduler.schedule(
                () -> handOff(eventId, entry, () -> fire(eventId, entry)),
                new CronTrigger(rule.cron(), zone));
        entry.setHandle(handle);

        Instant next = rule.nextFireAfter(Instant.now(), zone).orElse(null);
        writeNextRunAt(eventId, next);
        log.info("Scheduled event {} with rule '{}', next run at {}", eventId, rule, next);
    }

    /** Runs with the executing guard held. */
    private void runStartTime(String eventId, JobRegistryEntry pending) {
        if (registry.get(eventId) != pending || pending.isCancelled()) {
            return;
        }
        Optional<EventDocument> current = eventStore.findEvent(eventId);
        if (current.isEmpty() || current.get().getStatus() != EventStatus.ACTIVE) {
            log.info("Event {} is gone or inactive at its start time, unscheduling", eventId);
            unschedule(eventId);
            return;
        }
        launch(current.get(), pending);
        if (registry.get(eventId) == pending && !pending.isCancelled()) {
            try {
                installRecurringRule(current.get());
            } catch (UnsupportedCadenceException e) {
                log.error("Cannot install recurring rule for event {}: {}", eventId, e.getMessage());
                unschedule(eventId);
            }
        }
    }

    // ------------------------------------------------------------------
    // Firing
    // ------------------------------------------------------------------

    /**
     * Timer-thread side of a fire: claims the executing guard, then hands the run to the fire pool.
     * The guard is released when the run ends or when the pool rejects it.
     */
    private void handOff(String eventId, JobRegistryEntry entry, Runnable run) {
        if (registry.get(eventId) != entry || entry.isCancelled()) {
            log.debug("Dropping fire for event {} from a replaced timer", eventId);
            return;
        }
        if (!executing.add(eventId)) {
            log.debug("Event {} is still executing, dropping fire", eventId);
            return;
        }
        try {
            fireExecutor.execute(() -> {
                try {
                    run.run();
                } finally {
                    executing.remove(eventId);
                }
            });
        } catch (RejectedExecutionException e) {
            executing.remove(eventId);
            log.warn("Fire pool rejected the run of event {}, dropping fire", eventId);
        }
    }

    /** Runs with the executing guard held. */
    private void fire(String eventId, JobRegistryEntry entry) {
        if (registry.get(eventId) != entry || entry.isCancelled()) {
            log.debug("Dropping fire for event {} from a replaced timer", eventId);
            return;
        }

        Optional<EventDocument> current;
        try {
            current = eventStore.findEvent(eventId);
        } catch (RuntimeException e) {
            log.error("Could not load event {} for scheduled run", eventId, e);
            return;
        }
        if (current.isEmpty() || current.get().getStatus() != EventStatus.ACTIVE) {
            log.info("Event {} is gone or no longer active, cancelling its timer", eventId);
            unschedule(eventId);
            return;
        }

        if (entry.firedTooRecently(Instant.now())) {
            log.debug("Event {} fired less than {} ago, dropping fire", eventId, entry.minimumInterval());
            return;
        }

        launch(current.get(), entry);

        if (registry.get(eventId) == entry && entry.rule() != null) {
            writeNextRunAt(eventId, entry.rule().nextFireAfter(Instant.now(), zone).orElse(null));
        }
    }

    private void launch(EventDocument event, JobRegistryEntry entry) {
        String eventId = event.getEventId();
        try {
            entry.markFired(Instant.now());
            log.debug("Firing event {}", eventId);
            ExecutionResult result = launcher.launch(event, TriggeredBy.SCHEDULE, Map.of(), true);
            if (!result.success()) {
                log.warn("Scheduled run of event {} failed: {}", eventId, result.output());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled run of event {} failed", eventId, e);
        }
    }

    // ------------------------------------------------------------------
    // On-demand
    // ------------------------------------------------------------------

    public ExecutionResult runNow(String eventId) {
        return runNow(eventId, TriggeredBy.MANUAL, Map.of(), false);
    }

    /**
     * Runs the event once with its current state, outside its timer. The run gets its own log
     * record and its own conditional-action fan-out.
     */
    public ExecutionResult runNow(String eventId, TriggeredBy triggeredBy, Map<String, Object> input, boolean wait) {
        EventDocument event = eventStore.findEvent(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
        JobRegistryEntry entry = registry.get(eventId);
        if (entry != null) {
            entry.markFired(Instant.now());
        }
        log.info("Running event {} now ({})", eventId, triggeredBy);
        return launcher.launch(event, triggeredBy, input == null ? Map.of() : input, wait);
    }

    public void reschedule(String eventId) {
        Optional<EventDocument> event = eventStore.findEvent(eventId);
        if (event.isPresent()) {
            schedule(event.get());
        } else {
            unschedule(eventId);
        }
    }

    public void unschedule(String eventId) {
        JobRegistryEntry entry = registry.remove(eventId);
        if (entry != null) {
            entry.cancel();
            log.info("Unscheduled event {}", eventId);
        }
        writeNextRunAt(eventId, null);
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public ScheduleStatusResponse status(String eventId) {
        JobRegistryEntry entry = registry.get(eventId);
        return new ScheduleStatusResponse(
                eventId,
                entry != null && !entry.isCancelled(),
                executing.contains(eventId),
                entry == null ? null : entry.lastFireTime(),
                nextRunAt(eventId).orElse(null));
    }

    public Optional<Instant> nextRunAt(String eventId) {
        JobRegistryEntry entry = registry.get(eventId);
        if (entry == null || entry.isCancelled() || entry.rule() == null) {
            return Optional.empty();
        }
        return entry.rule().nextFireAfter(Instant.now(), zone);
    }

    public boolean isScheduled(String eventId) {
        JobRegistryEntry entry = registry.get(eventId);
        return entry != null && !entry.isCancelled();
    }

    public boolean isExecuting(String eventId) {
        return executing.contains(eventId);
    }

    public int scheduledCount() {
        return registry.size();
    }

    // ------------------------------------------------------------------
    // Shutdown
    // ------------------------------------------------------------------

    @PreDestroy
    public void shutdown() {
        log.info("Stopping scheduler, cancelling {} timers", registry.size());
        cancelAll();
    }

    private void cancelAll() {
        for (String eventId : List.copyOf(registry.keySet())) {
            JobRegistryEntry entry = registry.remove(eventId);
            if (entry != null) entry.cancel();
        }
    }

    private void writeNextRunAt(String eventId, Instant nextRunAt) {
        try {
            eventStore.updateNextRunAt(eventId, nextRunAt);
        } catch (RuntimeException e) {
            log.warn("Could not record next run for event {}: {}", eventId, e.getMessage());
        }
    }
}
