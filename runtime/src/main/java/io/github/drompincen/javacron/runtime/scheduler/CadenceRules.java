package io.github.drompincen.javacron.runtime.scheduler;

import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.protocol.api.CadenceUnit;

import java.time.Duration;
import java.util.StringJoiner;

/**
 * Maps an event's cadence onto a {@link RecurrenceRule} and onto the shortest gap allowed
 * between two accepted fires.
 */
public final class CadenceRules {

    static final Duration MIN_FIRE_GAP = Duration.ofMillis(500);

    private CadenceRules() {
    }

    public static RecurrenceRule ruleFor(EventDocument event) {
        if (event.getCustomSchedule() != null && !event.getCustomSchedule().isBlank()) {
            return RecurrenceRule.fromCron(event.getCustomSchedule());
        }
        Integer number = event.getScheduleNumber();
        CadenceUnit unit = event.getScheduleUnit();
        if (number == null || unit == null) {
            throw new UnsupportedCadenceException("Event " + event.getEventId() + " has no cadence");
        }
        if (number <= 0) {
            throw new UnsupportedCadenceException("Cadence must be positive, got " + number + " " + unit);
        }
        return RecurrenceRule.fromCron(cronFor(number, unit));
    }

    static String cronFor(int number, CadenceUnit unit) {
        return switch (unit) {
            case SECONDS -> switch (number) {
                case 15 -> "0,15,30,45 * * * * *";
                case 30 -> "0,30 * * * * *";
                default -> (number % 60) + " * * * * *";
            };
            case MINUTES -> "0 " + steps(number, 60) + " * * * *";
            case HOURS -> "0 0 " + steps(number, 24) + " * * *";
            case DAYS -> "0 0 0 * * " + steps(number, 7);
        };
    }

    private static String steps(int every, int range) {
        StringJoiner joiner = new StringJoiner(",");
        for (int value = 0; value < range; value += every) {
            joiner.add(Integer.toString(value));
        }
        return joiner.toString();
    }

    public static Duration minimumInterval(EventDocument event) {
        boolean structured = event.getCustomSchedule() == null || event.getCustomSchedule().isBlank();
        Integer number = event.getScheduleNumber();
        if (!structured || number == null || number <= 0 || event.getScheduleUnit() == null) {
            return MIN_FIRE_GAP;
        }
        return switch (event.getScheduleUnit()) {
            case SECONDS -> max(MIN_FIRE_GAP, Duration.ofMillis(number * 800L));
            case MINUTES -> number == 1
                    ? Duration.ofSeconds(2)
                    : max(MIN_FIRE_GAP, Duration.ofMillis(number * 6_000L));
            case HOURS, DAYS -> MIN_FIRE_GAP;
        };
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
