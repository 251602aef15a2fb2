package io.etl4j.internal;

import io.etl4j.core.Schedule;
import io.etl4j.store.ScheduleStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link ScheduleStore} with the same claim semantics as the Mongo store.
 */
class ClaimingScheduleStore implements ScheduleStore {

    private static final class Row {
        Schedule schedule;
        Instant lockUntil;
        String lockedBy;

        Row(Schedule schedule) {
            this.schedule = schedule;
        }
    }

    private final Clock clock;
    private final Map<String, Row> rows = new LinkedHashMap<>();
    final AtomicInteger releases = new AtomicInteger();

    ClaimingScheduleStore(Clock clock) {
        this.clock = clock;
    }

    synchronized String lockedBy(String id) {
        Row row = rows.get(id);
        return row == null ? null : row.lockedBy;
    }

    synchronized Instant lockUntil(String id) {
        Row row = rows.get(id);
        return row == null ? null : row.lockUntil;
    }

    @Override
    public synchronized Optional<Schedule> findById(String id) {
        return Optional.ofNullable(rows.get(id)).map(r -> r.schedule);
    }

    @Override
    public synchronized List<Schedule> findActive() {
        return rows.values().stream().map(r -> r.schedule).filter(Schedule::active).toList();
    }

    @Override
    public synchronized Schedule save(Schedule schedule) {
        Schedule stored = schedule.id() == null ? schedule.withId(UUID.randomUUID().toString()) : schedule;
        Row row = rows.get(stored.id());
        if (row == null) {
            rows.put(stored.id(), new Row(stored));
        } else {
            row.schedule = stored;
        }
        return stored;
    }

    @Override
    public synchronized List<Schedule> claimDue(Instant windowEnd, int limit, Duration lockLifetime, String workerId) {
        Instant now = clock.instant();
        List<Row> due = rows.values().stream()
                .filter(r -> r.schedule.active() && r.schedule.nextRun() != null && !r.schedule.nextRun().isAfter(windowEnd))
                .filter(r -> r.lockUntil == null || !r.lockUntil.isAfter(now))
                .sorted(Comparator.comparing(r -> r.schedule.nextRun()))
                .limit(limit)
                .toList();
        List<Schedule> claimed = new ArrayList<>();
        for (Row r : due) {
            r.lockUntil = now.plus(lockLifetime);
            r.lockedBy = workerId;
            claimed.add(r.schedule);
        }
        return claimed;
    }

    @Override
    public synchronized Optional<Schedule> claim(String id, Duration lockLifetime, String workerId, Instant now) {
        Row r = rows.get(id);
        if (r == null || !r.schedule.active()) {
            return Optional.empty();
        }
        boolean free = r.lockUntil == null || !r.lockUntil.isAfter(now) || workerId.equals(r.lockedBy);
        if (!free) {
            return Optional.empty();
        }
        r.lockUntil = now.plus(lockLifetime);
        r.lockedBy = workerId;
        return Optional.of(r.schedule);
    }

    @Override
    public synchronized void recordSuccess(String id, Instant lastRun, Instant nextRun) {
        Row r = rows.get(id);
        Schedule s = r.schedule;
        r.schedule = new Schedule(s.id(), s.ownerId(), s.sourceId(), s.transformationId(), s.destinationId(),
                s.frequency(), s.timeOfDay(), s.dayOfWeek(), s.dayOfMonth(), s.timezone(), lastRun, nextRun, s.active(), 0);
    }

    @Override
    public synchronized int recordFailure(String id, Instant nextRun, boolean pause) {
        Row r = rows.get(id);
        Schedule s = r.schedule;
        r.schedule = new Schedule(s.id(), s.ownerId(), s.sourceId(), s.transformationId(), s.destinationId(),
                s.frequency(), s.timeOfDay(), s.dayOfWeek(), s.dayOfMonth(), s.timezone(), s.lastRun(), nextRun,
                s.active() && !pause, s.consecutiveFailures() + 1);
        return r.schedule.consecutiveFailures();
    }

    @Override
    public synchronized boolean extendClaim(String id, String workerId, Duration lockLifetime, Instant now) {
        Row r = rows.get(id);
        if (r == null || !workerId.equals(r.lockedBy)) {
            return false;
        }
        r.lockUntil = now.plus(lockLifetime);
        return true;
    }

    @Override
    public synchronized void release(String id, String workerId) {
        Row r = rows.get(id);
        if (r != null && workerId.equals(r.lockedBy)) {
            r.lockUntil = null;
            r.lockedBy = null;
            releases.incrementAndGet();
        }
    }

    @Override
    public synchronized boolean deactivate(String id) {
        Row r = rows.get(id);
        if (r == null) {
            return false;
        }
        r.schedule = r.schedule.withActive(false);
        return true;
    }
}
