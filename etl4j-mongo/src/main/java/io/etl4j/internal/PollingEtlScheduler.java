package io.etl4j.internal;

import io.etl4j.EtlScheduler;
import io.etl4j.config.EtlProperties;
import io.etl4j.core.Schedule;
import io.etl4j.core.TriggerResult;
import io.etl4j.pipeline.JobExecutionEngine;
import io.etl4j.store.ScheduleStore;
import io.etl4j.utils.NextRunCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Store-backed ETL scheduler.
 *
 * <p>A poller claims due schedules in the {@link ScheduleStore} and turns them into delayed
 * triggers in a {@link ScheduleRegistry}. A dispatcher hands due triggers to a bounded worker pool,
 * which runs them through the {@link JobExecutionEngine}.
 *
 * <p>Single-flight holds on two levels: the store claim keeps other processes away and the
 * registry's run permit coalesces overlapping firings inside this process. While a run is in flight
 * its claim is extended every third of {@code lockLifetime}, so runs longer than the lock lifetime
 * keep their lock.
 *
 * <pre>{@code
 * scheduler.start();
 * Schedule saved = scheduler.register(Schedule.daily(null, "user-1", "src-1", null, "dst-1",
 *         LocalTime.of(6, 30), "Europe/Berlin"));
 * scheduler.runNow(saved.id());
 * scheduler.stop();
 * }</pre>
 */
public class PollingEtlScheduler implements EtlScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingEtlScheduler.class);

    private static final int MAX_SYSTEM_ERRORS = 30;

    private final EtlProperties.Scheduler props;
    private final ScheduleStore scheduleStore;
    private final JobExecutionEngine engine;
    private final ScheduleRegistry registry;
    private final Clock clock;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore refillSignal = new Semaphore(0);
    private final Semaphore globalSem;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private ExecutorService workerPool;
    private ScheduledExecutorService lockRenewer;
    private Thread pollerThread;
    private Thread dispatcherThread;
    private int systemErrorCount = 0;

    public PollingEtlScheduler(EtlProperties.Scheduler props, ScheduleStore scheduleStore, JobExecutionEngine engine,
                               Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("etl4j.scheduler.maxConcurrency must be positive");
        }
        this.registry = new ScheduleRegistry(clock);
        this.globalSem = new Semaphore(props.getMaxConcurrency());
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    public String workerId() {
        return workerId;
    }

    ScheduleRegistry registry() {
        return registry;
    }

    /**
     * Start polling and executing due schedules. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "etl4j.scheduler.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("etl4j.scheduler.processEvery must be a positive duration");
        }
        Duration lockLifetime = Objects.requireNonNull(props.getLockLifetime(), "etl4j.scheduler.lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("etl4j.scheduler.lockLifetime must be a positive duration");
        }

        log.info("etl4j scheduler starting processEvery={} lockLifetime={} workerId={} maxConcurrency={} batchSize={} maxConsecutiveFailures={}",
                props.getProcessEvery(),
                props.getLockLifetime(),
                workerId,
                props.getMaxConcurrency(),
                props.getBatchSize(),
                props.getMaxConsecutiveFailures());

        systemErrorCount = 0;
        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("etl4j.worker");
            t.setDaemon(true);
            return t;
        });

        long renewEvery = Math.max(1000L, lockLifetime.toMillis() / 3);
        lockRenewer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("etl4j.lock-renewer");
            t.setDaemon(true);
            return t;
        });
        lockRenewer.scheduleWithFixedDelay(this::extendClaims, renewEvery, renewEvery, TimeUnit.MILLISECONDS);

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("etl4j.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("etl4j.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();

        log.info("etl4j scheduler started");
    }

    /**
     * Stop polling, let in-flight runs finish (up to the lock lifetime) and give back the claims of
     * triggers that never fired. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("etl4j scheduler stopping");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        for (String id : registry.drainPending()) {
            releaseQuietly(id);
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getLockLifetime().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        if (lockRenewer != null) {
            lockRenewer.shutdownNow();
            lockRenewer = null;
        }

        refillSignal.drainPermits();
        log.info("etl4j scheduler stopped");
    }

    @Override
    public Schedule register(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Instant next = NextRunCalculator.nextRun(schedule, clock.instant());
        Schedule toSave = new Schedule(schedule.id(), schedule.ownerId(), schedule.sourceId(),
                schedule.transformationId(), schedule.destinationId(), schedule.frequency(), schedule.timeOfDay(),
                schedule.dayOfWeek(), schedule.dayOfMonth(), schedule.timezone(), schedule.lastRun(), next, true, 0);

        Schedule saved = scheduleStore.save(toSave);
        log.info("etl4j schedule registered scheduleId={} frequency={} nextRun={}", saved.id(), saved.frequency(), next);
        return saved;
    }

    @Override
    public Schedule reschedule(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(schedule.id(), "schedule id must not be null");

        Schedule existing = scheduleStore.findById(schedule.id())
                .orElseThrow(() -> new IllegalArgumentException("schedule not found: " + schedule.id()));

        Instant next = NextRunCalculator.nextRun(schedule, clock.instant());
        Schedule saved = scheduleStore.save(new Schedule(existing.id(), schedule.ownerId(), schedule.sourceId(),
                schedule.transformationId(), schedule.destinationId(), schedule.frequency(), schedule.timeOfDay(),
                schedule.dayOfWeek(), schedule.dayOfMonth(), schedule.timezone(), existing.lastRun(), next,
                existing.active(), existing.consecutiveFailures()));

        dropPending(saved.id());
        log.info("etl4j schedule rescheduled scheduleId={} frequency={} nextRun={}", saved.id(), saved.frequency(), next);
        return saved;
    }

    @Override
    public boolean deactivate(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        boolean found = scheduleStore.deactivate(scheduleId);
        dropPending(scheduleId);
        if (found) {
            log.info("etl4j schedule deactivated scheduleId={} running={}", scheduleId, registry.isRunning(scheduleId));
        }
        return found;
    }

    /**
     * May block while every worker is busy.
     */
    @Override
    public TriggerResult runNow(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        if (!started.get()) {
            throw new IllegalStateException("scheduler is not started");
        }

        Optional<Schedule> found = scheduleStore.findById(scheduleId).filter(Schedule::active);
        if (found.isEmpty()) {
            return TriggerResult.NOT_FOUND;
        }

        if (!registry.tryBeginRun(scheduleId)) {
            log.info("etl4j manual run coalesced scheduleId={} reason=running", scheduleId);
            return TriggerResult.COALESCED;
        }

        Optional<Schedule> claimed;
        try {
            claimed = scheduleStore.claim(scheduleId, props.getLockLifetime(), workerId, clock.instant());
        } catch (RuntimeException e) {
            registry.endRun(scheduleId);
            throw e;
        }
        if (claimed.isEmpty()) {
            registry.endRun(scheduleId);
            log.info("etl4j manual run coalesced scheduleId={} reason=claimed-elsewhere", scheduleId);
            return TriggerResult.COALESCED;
        }

        // The claim now belongs to the manual run; a waiting timed trigger would fire a second run.
        registry.cancelPending(scheduleId);

        log.info("etl4j manual run started scheduleId={}", scheduleId);
        submit(claimed.get());
        return TriggerResult.STARTED;
    }

    private void dropPending(String scheduleId) {
        if (registry.cancelPending(scheduleId) != null && !registry.isRunning(scheduleId)) {
            releaseQuietly(scheduleId);
        }
    }

    private static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "etl4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("etl4j could not resolve host name, using default msg={}", e.getMessage());
        }

        String pid = Long.toString(ManagementFactory.getRuntimeMXBean().getPid());

        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        return generated.length() > 128 ? generated.substring(0, 128) : generated;
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("etl4j pollOnce failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    log.error("etl4j scheduler stopping after {} consecutive poll failures", systemErrorCount);
                    Thread stopper = new Thread(this::stop, "etl4j.stopper");
                    stopper.setDaemon(true);
                    stopper.start();
                    break;
                }
                try {
                    Duration sleep = systemErrorCount >= 10 ? Duration.ofSeconds(60) : backoff(systemErrorCount);
                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    refillSignal.tryAcquire(props.getProcessEvery().toMillis(), TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * @return true when the pool is saturated and more due schedules may be waiting
     */
    boolean pollOnce() {
        Instant windowEnd = clock.instant().plus(props.getProcessEvery());

        int running = props.getMaxConcurrency() - globalSem.availablePermits();
        int remaining = Math.max(0, props.getMaxConcurrency() - registry.pendingCount() - running);
        if (remaining == 0) {
            return true;
        }

        int batchSize = Math.max(1, props.getBatchSize());
        while (remaining > 0) {
            int take = Math.min(batchSize, remaining);
            List<Schedule> claimed = scheduleStore.claimDue(windowEnd, take, props.getLockLifetime(), workerId);
            log.debug("etl4j polled schedules count={} windowEnd={} remaining={}", claimed.size(), windowEnd, remaining);

            for (Schedule schedule : claimed) {
                if (registry.offer(schedule, schedule.nextRun())) {
                    remaining--;
                } else {
                    log.debug("etl4j trigger already pending scheduleId={}", schedule.id());
                }
            }

            if (claimed.size() < take) {
                return false;
            }
        }
        return true;
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                ScheduleRegistry.Trigger trigger = registry.take();
                if (!registry.takeIfCurrent(trigger)) {
                    continue;
                }
                dispatch(trigger.schedule());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("etl4j dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void dispatch(Schedule schedule) {
        if (!registry.tryBeginRun(schedule.id())) {
            // The in-flight run holds the same claim and releases it when done.
            log.info("etl4j timed run coalesced scheduleId={} reason=running", schedule.id());
            return;
        }
        submit(schedule);
    }

    /**
     * Caller holds the run permit and the store claim; both are given back when the task ends.
     */
    private void submit(Schedule claimed) {
        globalSem.acquireUninterruptibly();
        Map<String, String> context = copyMdc();
        try {
            ExecutorService pool = workerPool;
            if (pool == null) {
                throw new IllegalStateException("scheduler is stopping");
            }
            inFlight.add(claimed.id());
            pool.submit(() -> {
                context.forEach(MDC::put);
                MDC.put(JobExecutionEngine.MDC_SCHEDULE_ID, claimed.id());
                try {
                    runClaimed(claimed.id());
                } finally {
                    inFlight.remove(claimed.id());
                    registry.endRun(claimed.id());
                    releaseQuietly(claimed.id());
                    globalSem.release();
                    refillSignal.release();
                    MDC.clear();
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(claimed.id());
            registry.endRun(claimed.id());
            releaseQuietly(claimed.id());
            globalSem.release();
            throw e;
        }
    }

    /**
     * Extend the claims of all runs in flight. A claim that was lost is only logged; the run
     * continues.
     */
    void extendClaims() {
        for (String scheduleId : inFlight) {
            try {
                if (!scheduleStore.extendClaim(scheduleId, workerId, props.getLockLifetime(), clock.instant())) {
                    log.warn("etl4j claim lost while running scheduleId={} workerId={}", scheduleId, workerId);
                }
            } catch (RuntimeException e) {
                log.warn("etl4j claim extension failed scheduleId={} msg={}", scheduleId, e.getMessage(), e);
            }
        }
    }

    private void runClaimed(String scheduleId) {
        Optional<Schedule> current;
        try {
            current = scheduleStore.findById(scheduleId).filter(Schedule::active);
        } catch (RuntimeException e) {
            log.error("etl4j could not load schedule scheduleId={} msg={}", scheduleId, e.getMessage(), e);
            return;
        }
        if (current.isEmpty()) {
            log.info("etl4j run skipped scheduleId={} reason=inactive", scheduleId);
            return;
        }

        Schedule schedule = current.get();
        try {
            engine.run(schedule);
        } catch (RuntimeException e) {
            recordFailure(schedule, e);
        }
    }

    private void recordFailure(Schedule schedule, RuntimeException failure) {
        try {
            Schedule latest = scheduleStore.findById(schedule.id()).orElse(schedule);
            Instant next = NextRunCalculator.nextRun(latest, clock.instant());
            int max = props.getMaxConsecutiveFailures();
            boolean pause = max > 0 && latest.consecutiveFailures() + 1 >= max;

            int failures = scheduleStore.recordFailure(schedule.id(), next, pause);
            if (pause) {
                log.warn("etl4j schedule paused after consecutive failures scheduleId={} failures={} max={}",
                        schedule.id(), failures, max);
            } else {
                log.warn("etl4j run failed scheduleId={} failures={} nextRun={} msg={}",
                        schedule.id(), failures, next, failure.getMessage());
            }
        } catch (RuntimeException storeEx) {
            log.error("etl4j recordFailure failed scheduleId={} msg={}", schedule.id(), storeEx.getMessage(), storeEx);
        }
    }

    private void releaseQuietly(String scheduleId) {
        try {
            scheduleStore.release(scheduleId, workerId);
        } catch (RuntimeException e) {
            // The lock expires after lockLifetime.
            log.warn("etl4j release failed scheduleId={} msg={}", scheduleId, e.getMessage(), e);
        }
    }

    private static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }
}
