package io.github.drompincen.javacron.runtime.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * The timer currently bound to one event. A cancelled entry stays cancelled: a handle attached
 * after {@link #cancel()} is cancelled on arrival.
 */
final class JobRegistryEntry {

    private final RecurrenceRule rule;
    private final Duration minimumInterval;
    private ScheduledFuture<?> handle;
    private volatile Instant lastFireTime;
    private volatile boolean cancelled;

    JobRegistryEntry(RecurrenceRule rule, Duration minimumInterval) {
        this.rule = rule;
        this.minimumInterval = minimumInterval;
    }

    synchronized void setHandle(ScheduledFuture<?> handle) {
        this.handle = handle;
        if (cancelled && handle != null) {
            handle.cancel(false);
        }
    }

    synchronized void cancel() {
        if (cancelled) return;
        cancelled = true;
        if (handle != null) {
            handle.cancel(false);
        }
    }

    boolean isCancelled() {
        return cancelled;
    }

    /** True when the gap since the last accepted fire is shorter than the cadence allows. */
    boolean firedTooRecently(Instant now) {
        Instant last = lastFireTime;
        return last != null && Duration.between(last, now).compareTo(minimumInterval) < 0;
    }

    /** Null while waiting for a future start time. */
    RecurrenceRule rule() {
        return rule;
    }

    Duration minimumInterval() {
        return minimumInterval;
    }

    Instant lastFireTime() {
        return lastFireTime;
    }

    void markFired(Instant at) {
        this.lastFireTime = at;
    }
}
