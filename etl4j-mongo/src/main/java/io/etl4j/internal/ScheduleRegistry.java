package io.etl4j.internal;

import io.etl4j.core.Schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process bookkeeping of pending triggers and running schedules.
 *
 * <p>Per schedule id there is at most one pending {@link Trigger} and one run permit. A trigger
 * taken from the queue only fires if it is still the current one; cancelling replaces nothing and
 * just drops it.
 */
public class ScheduleRegistry {

    private final Clock clock;
    private final DelayQueue<Trigger> queue = new DelayQueue<>();
    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

    public ScheduleRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    private static final class Slot {
        private final AtomicReference<Trigger> pending = new AtomicReference<>();
        private final Semaphore runPermit = new Semaphore(1);
    }

    /**
     * A claimed schedule waiting for its fire time.
     */
    public final class Trigger implements Delayed {
        private final Schedule schedule;
        private final Instant fireAt;

        private Trigger(Schedule schedule, Instant fireAt) {
            this.schedule = schedule;
            this.fireAt = fireAt;
        }

        public Schedule schedule() {
            return schedule;
        }

        public Instant fireAt() {
            return fireAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), fireAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof Trigger o) {
                return this.fireAt.compareTo(o.fireAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    private Slot slot(String scheduleId) {
        return slots.computeIfAbsent(scheduleId, id -> new Slot());
    }

    /**
     * Queue a trigger unless one is already pending for this schedule.
     *
     * @return false when a trigger was already pending
     */
    public boolean offer(Schedule schedule, Instant fireAt) {
        Objects.requireNonNull(schedule.id(), "schedule id must not be null");
        Objects.requireNonNull(fireAt, "fireAt must not be null");
        Trigger trigger = new Trigger(schedule, fireAt);
        if (!slot(schedule.id()).pending.compareAndSet(null, trigger)) {
            return false;
        }
        queue.offer(trigger);
        return true;
    }

    /**
     * Blocks until a trigger is due. The caller must check {@link #takeIfCurrent(Trigger)}.
     */
    public Trigger take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Marks the trigger as fired.
     *
     * @return false when it was cancelled after being queued
     */
    public boolean takeIfCurrent(Trigger trigger) {
        Slot slot = slots.get(trigger.schedule.id());
        return slot != null && slot.pending.compareAndSet(trigger, null);
    }

    /**
     * Drop the pending trigger of a schedule.
     *
     * @return the dropped trigger, or null when none was pending
     */
    public Trigger cancelPending(String scheduleId) {
        Slot slot = slots.get(scheduleId);
        if (slot == null) {
            return null;
        }
        Trigger dropped = slot.pending.getAndSet(null);
        if (dropped != null) {
            queue.remove(dropped);
        }
        return dropped;
    }

    public boolean hasPending(String scheduleId) {
        Slot slot = slots.get(scheduleId);
        return slot != null && slot.pending.get() != null;
    }

    public int pendingCount() {
        return (int) slots.values().stream().filter(s -> s.pending.get() != null).count();
    }

    /**
     * Non-blocking. Every successful call must be paired with {@link #endRun(String)}.
     */
    public boolean tryBeginRun(String scheduleId) {
        return slot(scheduleId).runPermit.tryAcquire();
    }

    public void endRun(String scheduleId) {
        Slot slot = slots.get(scheduleId);
        if (slot == null || slot.runPermit.availablePermits() > 0) {
            throw new IllegalStateException("no run in flight for schedule " + scheduleId);
        }
        slot.runPermit.release();
    }

    public boolean isRunning(String scheduleId) {
        Slot slot = slots.get(scheduleId);
        return slot != null && slot.runPermit.availablePermits() == 0;
    }

    /**
     * Drop every pending trigger.
     *
     * @return ids of the schedules whose trigger was dropped
     */
    public List<String> drainPending() {
        List<String> drained = new ArrayList<>();
        for (var e : slots.entrySet()) {
            if (e.getValue().pending.getAndSet(null) != null) {
                drained.add(e.getKey());
            }
        }
        queue.clear();
        return drained;
    }
}
