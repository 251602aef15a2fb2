package io.etl4j.internal;

import io.etl4j.core.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleRegistryTest {

    private final ScheduleRegistry registry = new ScheduleRegistry(Clock.systemUTC());

    private static Schedule schedule(String id) {
        return Schedule.daily(id, "owner", "src", null, "dst", LocalTime.of(6, 0), "UTC");
    }

    @Test
    void offerShouldKeepAtMostOnePendingTriggerPerSchedule() {
        Instant past = Instant.now().minusSeconds(1);

        assertTrue(registry.offer(schedule("a"), past));
        assertFalse(registry.offer(schedule("a"), past));
        assertTrue(registry.offer(schedule("b"), past));

        assertEquals(2, registry.pendingCount());
    }

    @Test
    void cancelledTriggerShouldNotFire() throws Exception {
        registry.offer(schedule("a"), Instant.now().minusSeconds(1));
        registry.offer(schedule("b"), Instant.now().minusMillis(500));

        assertNotNull(registry.cancelPending("a"));
        assertFalse(registry.hasPending("a"));

        ScheduleRegistry.Trigger next = registry.take();
        assertEquals("b", next.schedule().id());
        assertTrue(registry.takeIfCurrent(next));
        assertFalse(registry.takeIfCurrent(next));
        assertEquals(0, registry.pendingCount());
    }

    @Test
    void cancelPendingWithoutTriggerShouldReturnNull() {
        assertNull(registry.cancelPending("unknown"));
    }

    @Test
    void triggersShouldComeOutInFireOrder() throws Exception {
        Instant now = Instant.now();
        registry.offer(schedule("late"), now.minusMillis(10));
        registry.offer(schedule("early"), now.minusSeconds(10));

        assertEquals("early", registry.take().schedule().id());
        assertEquals("late", registry.take().schedule().id());
    }

    @Test
    void runPermitShouldBeSingleFlight() {
        assertTrue(registry.tryBeginRun("a"));
        assertTrue(registry.isRunning("a"));
        assertFalse(registry.tryBeginRun("a"));
        assertTrue(registry.tryBeginRun("b"));

        registry.endRun("a");
        assertFalse(registry.isRunning("a"));
        assertTrue(registry.tryBeginRun("a"));
    }

    @Test
    void endRunWithoutBeginShouldThrow() {
        assertThrows(IllegalStateException.class, () -> registry.endRun("a"));
        registry.tryBeginRun("b");
        registry.endRun("b");
        assertThrows(IllegalStateException.class, () -> registry.endRun("b"));
    }

    @Test
    void drainPendingShouldReturnDroppedIds() {
        registry.offer(schedule("a"), Instant.now().plusSeconds(60));
        registry.offer(schedule("b"), Instant.now().plusSeconds(60));

        List<String> drained = registry.drainPending();

        assertEquals(2, drained.size());
        assertTrue(drained.containsAll(List.of("a", "b")));
        assertEquals(0, registry.pendingCount());
        assertTrue(registry.offer(schedule("a"), Instant.now()));
    }

    @Test
    void triggerShouldExposeScheduleAndFireTime() {
        Instant fireAt = Instant.now().plusSeconds(5);
        Schedule s = schedule("a");
        registry.offer(s, fireAt);

        ScheduleRegistry.Trigger dropped = registry.cancelPending("a");
        assertSame(s, dropped.schedule());
        assertEquals(fireAt, dropped.fireAt());
    }
}
