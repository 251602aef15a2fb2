package io.etl4j.config;

import io.etl4j.EtlScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler's start/stop with the Spring container lifecycle.
 */
public class EtlLifecycle implements SmartLifecycle {
    private final EtlScheduler scheduler;
    private volatile boolean running = false;

    public EtlLifecycle(EtlScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // Last to start, first to stop: runs need every other bean.
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
