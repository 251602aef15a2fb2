package io.etl4j.utils;

import io.etl4j.core.Schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Computes the next run instant of a {@link Schedule} in the schedule's own zone.
 * <p>
 * Rules:
 * <ul>
 *   <li>DAILY: today at timeOfDay if that is strictly after {@code from}, else tomorrow.</li>
 *   <li>WEEKLY: {@code (7 + dayOfWeek - today) mod 7} days ahead (0 = Sunday). When that is today
 *       and the time has passed, the run moves a full week ahead; it never fires late.</li>
 *   <li>MONTHLY: dayOfMonth of this month, else of next month. Days beyond the month's length
 *       fall on its last day (31 becomes Feb 28/29).</li>
 * </ul>
 * The result is always strictly after {@code from}.
 */
public final class NextRunCalculator {
    private NextRunCalculator() {
    }

    public static Instant nextRun(Schedule schedule, Instant from) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(from, "from must not be null");

        ZoneId zone = schedule.zone();
        ZonedDateTime base = ZonedDateTime.ofInstant(from, zone);

        ZonedDateTime candidate = switch (schedule.frequency()) {
            case DAILY -> {
                ZonedDateTime today = base.with(schedule.timeOfDay());
                yield today.isAfter(base) ? today : atTime(base.toLocalDate().plusDays(1), schedule, zone);
            }
            case WEEKLY -> {
                int todayDow = toSundayBased(base.getDayOfWeek());
                int daysAhead = Math.floorMod(7 + schedule.dayOfWeek() - todayDow, 7);
                ZonedDateTime next = atTime(base.toLocalDate().plusDays(daysAhead), schedule, zone);
                yield next.isAfter(base) ? next : atTime(base.toLocalDate().plusDays(daysAhead + 7L), schedule, zone);
            }
            case MONTHLY -> {
                YearMonth month = YearMonth.from(base);
                ZonedDateTime thisMonth = atTime(dayInMonth(month, schedule.dayOfMonth()), schedule, zone);
                yield thisMonth.isAfter(base)
                        ? thisMonth
                        : atTime(dayInMonth(month.plusMonths(1), schedule.dayOfMonth()), schedule, zone);
            }
        };

        return candidate.toInstant();
    }

    /**
     * Convenience overload: computes from {@link Instant#now()}.
     */
    public static Instant nextRun(Schedule schedule) {
        return nextRun(schedule, Instant.now());
    }

    /**
     * Maps {@link DayOfWeek} (Monday = 1 .. Sunday = 7) to 0 = Sunday .. 6 = Saturday.
     */
    public static int toSundayBased(DayOfWeek dow) {
        return dow.getValue() % 7;
    }

    private static ZonedDateTime atTime(LocalDate date, Schedule schedule, ZoneId zone) {
        return ZonedDateTime.of(date, schedule.timeOfDay(), zone);
    }

    private static LocalDate dayInMonth(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }
}
