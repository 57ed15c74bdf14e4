package io.qzark.config;

import io.qzark.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges Scheduler start/stop lifecycle with the Spring container lifecycle.
 */
public class QzarkLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(QzarkLifecycle.class);

    private final Scheduler scheduler;
    private volatile boolean running = false;
    private volatile long startedAtNanos;

    public QzarkLifecycle(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        startedAtNanos = System.nanoTime();
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
        log.debug("End. Session time: {} seconds", String.format("%.4f", (System.nanoTime() - startedAtNanos) / 1e9));
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
