package io.etl4j.core;

import java.time.Instant;
import java.time.LocalTime;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * A recurring ETL job definition.
 *
 * <p>{@code dayOfWeek} uses 0 = Sunday .. 6 = Saturday. {@code timeOfDay} has at most second
 * precision. {@code timezone} is an IANA id; when null the system default zone is used.
 */
public record Schedule(
        String id,
        String ownerId,
        String sourceId,
        String transformationId,
        String destinationId,
        Frequency frequency,
        LocalTime timeOfDay,
        Integer dayOfWeek,
        Integer dayOfMonth,
        String timezone,
        Instant lastRun,
        Instant nextRun,
        boolean active,
        int consecutiveFailures
) {
    public Schedule {
        Objects.requireNonNull(frequency, "frequency must not be null");
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        if (timeOfDay.getNano() != 0) {
            throw new IllegalArgumentException("timeOfDay must be whole seconds, got " + timeOfDay);
        }
        if (frequency == Frequency.WEEKLY && (dayOfWeek == null || dayOfWeek < 0 || dayOfWeek > 6)) {
            throw new IllegalArgumentException("WEEKLY schedule requires dayOfWeek in 0..6, got " + dayOfWeek);
        }
        if (frequency == Frequency.MONTHLY && (dayOfMonth == null || dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new IllegalArgumentException("MONTHLY schedule requires dayOfMonth in 1..31, got " + dayOfMonth);
        }
        if (timezone != null && !timezone.isBlank()) {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Unknown timezone: " + timezone, e);
            }
        }
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures must not be negative");
        }
    }

    public static Schedule daily(String id, String ownerId, String sourceId, String transformationId,
                                 String destinationId, LocalTime timeOfDay, String timezone) {
        return new Schedule(id, ownerId, sourceId, transformationId, destinationId,
                Frequency.DAILY, timeOfDay, null, null, timezone, null, null, true, 0);
    }

    public static Schedule weekly(String id, String ownerId, String sourceId, String transformationId,
                                  String destinationId, int dayOfWeek, LocalTime timeOfDay, String timezone) {
        return new Schedule(id, ownerId, sourceId, transformationId, destinationId,
                Frequency.WEEKLY, timeOfDay, dayOfWeek, null, timezone, null, null, true, 0);
    }

    public static Schedule monthly(String id, String ownerId, String sourceId, String transformationId,
                                   String destinationId, int dayOfMonth, LocalTime timeOfDay, String timezone) {
        return new Schedule(id, ownerId, sourceId, transformationId, destinationId,
                Frequency.MONTHLY, timeOfDay, null, dayOfMonth, timezone, null, null, true, 0);
    }

    /**
     * Resolved zone; the system default when no timezone is set.
     */
    public ZoneId zone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timezone);
    }

    public Schedule withId(String newId) {
        return new Schedule(newId, ownerId, sourceId, transformationId, destinationId, frequency, timeOfDay,
                dayOfWeek, dayOfMonth, timezone, lastRun, nextRun, active, consecutiveFailures);
    }

    public Schedule withNextRun(Instant next) {
        return new Schedule(id, ownerId, sourceId, transformationId, destinationId, frequency, timeOfDay,
                dayOfWeek, dayOfMonth, timezone, lastRun, next, active, consecutiveFailures);
    }

    public Schedule withActive(boolean value) {
        return new Schedule(id, ownerId, sourceId, transformationId, destinationId, frequency, timeOfDay,
                dayOfWeek, dayOfMonth, timezone, lastRun, nextRun, value, consecutiveFailures);
    }
}
