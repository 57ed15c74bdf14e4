package io.qzark;

/**
 * Main scheduler API.
 *
 * <p>Polls the {@link TaskStore}, runs due tasks and alerts the configured notification channels
 * when a run fails. Tasks cycle through the store until the scheduler is stopped.
 */
public interface Scheduler {

    /**
     * Seed the store and start polling. Idempotent.
     */
    void start();

    /**
     * Stop polling after the current cycle and wait for running commands. Idempotent.
     */
    void stop();

    boolean isRunning();
}
