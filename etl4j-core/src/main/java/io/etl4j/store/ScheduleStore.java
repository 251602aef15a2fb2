package io.etl4j.store;

import io.etl4j.core.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of {@link Schedule}s, including the claim lock that makes runs single-flight
 * across processes.
 */
public interface ScheduleStore {

    Optional<Schedule> findById(String id);

    List<Schedule> findActive();

    /**
     * Insert (null id) or replace. Returns the stored schedule with its id.
     */
    Schedule save(Schedule schedule);

    /**
     * Atomically lock up to {@code limit} active schedules with {@code nextRun <= windowEnd} whose
     * lock is free or expired.
     */
    List<Schedule> claimDue(Instant windowEnd, int limit, Duration lockLifetime, String workerId);

    /**
     * Lock one active schedule regardless of its {@code nextRun}. Empty when it is missing,
     * inactive or locked by someone else.
     */
    Optional<Schedule> claim(String id, Duration lockLifetime, String workerId, Instant now);

    /**
     * Store a successful run and reset the failure counter.
     */
    void recordSuccess(String id, Instant lastRun, Instant nextRun);

    /**
     * Store a failed run: advance {@code nextRun}, increment the failure counter and deactivate
     * when {@code pause} is set.
     *
     * @return the updated failure count
     */
    int recordFailure(String id, Instant nextRun, boolean pause);

    /**
     * Push the lock of a running schedule to {@code now + lockLifetime}. Only the current holder
     * can extend; the schedule need not be active.
     *
     * @return false when {@code workerId} no longer holds the lock
     */
    boolean extendClaim(String id, String workerId, Duration lockLifetime, Instant now);

    void release(String id, String workerId);

    boolean deactivate(String id);
}
