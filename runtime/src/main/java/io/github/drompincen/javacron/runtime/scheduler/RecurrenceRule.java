package io.github.drompincen.javacron.runtime.scheduler;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * A six-field cron rule ({@code second minute hour day-of-month month day-of-week}) with its own
 * next-fire computation, so callers never need the timer's internal state to know when it fires.
 */
public final class RecurrenceRule {

    private final String cron;
    private final CronExpression expression;

    private RecurrenceRule(String cron, CronExpression expression) {
        this.cron = cron;
        this.expression = expression;
    }

    /** Parses a cron string; five-field expressions get a leading {@code 0} seconds field. */
    public static RecurrenceRule fromCron(String cron) {
        if (cron == null || cron.isBlank()) {
            throw new UnsupportedCadenceException("Cron expression is empty");
        }
        String normalized = cron.trim().replaceAll("\\s+", " ");
        if (normalized.split(" ").length == 5) {
            normalized = "0 " + normalized;
        }
        try {
            return new RecurrenceRule(normalized, CronExpression.parse(normalized));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedCadenceException("Invalid cron expression '" + cron + "': " + e.getMessage(), e);
        }
    }

    public Optional<Instant> nextFireAfter(Instant after, ZoneId zone) {
        ZonedDateTime next = expression.next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    public String cron() {
        return cron;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RecurrenceRule other && cron.equals(other.cron);
    }

    @Override
    public int hashCode() {
        return cron.hashCode();
    }

    @Override
    public String toString() {
        return cron;
    }
}
