package io.etl4j;

import io.etl4j.core.Schedule;
import io.etl4j.core.TriggerResult;

/**
 * Main scheduler API.
 *
 * <p>At most one run per schedule is in flight at any time, across all processes sharing the store.
 */
public interface EtlScheduler {
    void start();

    void stop();

    /**
     * Activate a new schedule and persist it with its first {@code nextRun}.
     */
    Schedule register(Schedule schedule);

    /**
     * Persist new timing for an existing schedule and drop its pending trigger.
     * A run already in flight is not interrupted.
     */
    Schedule reschedule(Schedule schedule);

    /**
     * Soft-delete. Execution history is kept and an in-flight run completes.
     */
    boolean deactivate(String scheduleId);

    /**
     * Trigger a run right away, subject to the same single-flight rule as timed runs.
     */
    TriggerResult runNow(String scheduleId);
}
