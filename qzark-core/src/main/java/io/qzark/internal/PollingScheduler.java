package io.qzark.internal;

import io.qzark.Scheduler;
import io.qzark.TaskExecutor;
import io.qzark.TaskStore;
import io.qzark.config.QzarkProperties;
import io.qzark.core.ExecutionResult;
import io.qzark.core.Task;
import io.qzark.core.TaskStoreException;
import io.qzark.notify.NotificationFanout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Queue-polling scheduler.
 *
 * <p>One poller thread drives every cycle:
 * <ol>
 *   <li>pop the head task from the {@link TaskStore}</li>
 *   <li>check whether it is due ({@code now - lastRun >= interval}, never-run tasks are due)</li>
 *   <li>if due and not already running, wait for a free worker, record the start time and hand it over</li>
 *   <li>requeue the task, whatever happened</li>
 *   <li>pause for {@code pollPause}</li>
 * </ol>
 *
 * <p>Workers run the command and invoke the {@link NotificationFanout} when the run fails.
 * The pool is bounded by {@code maxConcurrency}; with the default of one worker a running command
 * holds up the poller, which is the serialized behavior of a single loop. A set of in-flight task
 * names guarantees at most one concurrent run per task whatever the pool size.
 *
 * <p>Store failures never stop the loop: the cycle is skipped and retried with back-off. A task
 * whose requeue failed is kept aside and put back before the next pop.
 */
public class PollingScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    private static final Duration STOP_GRACE = Duration.ofSeconds(60);

    private final QzarkProperties props;
    private final TaskStore store;
    private final TaskExecutor executor;
    private final NotificationFanout fanout;
    private final List<Task> tasks;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;
    private Thread pollerThread;

    private final Semaphore wakeSignal = new Semaphore(0);
    private final Semaphore workerSem;

    private final ConcurrentHashMap<String, Instant> lastRun = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    // poller thread only
    private final Deque<Task> pendingRequeue = new ArrayDeque<>();
    private int storeErrorCount = 0;

    public PollingScheduler(QzarkProperties props,
                            TaskStore store,
                            TaskExecutor executor,
                            NotificationFanout fanout,
                            List<Task> tasks) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.fanout = Objects.requireNonNull(fanout, "fanout must not be null");
        this.tasks = List.copyOf(Objects.requireNonNull(tasks, "tasks must not be null"));
        this.workerSem = new Semaphore(props.getMaxConcurrency());
    }

    /**
     * Seed the store and start the poller. Store failures while seeding are fatal and propagate.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration pause = Objects.requireNonNull(props.getPollPause(), "qzark.pollPause must not be null");
        if (pause.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("qzark.pollPause must not be negative");
        }

        log.info("Scheduler starting with pollPause={}, maxConcurrency={}, tasks={}",
                pause, props.getMaxConcurrency(), tasks.size());

        try {
            seed();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        wakeSignal.drainPermits();

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("qzark.worker");
                t.setDaemon(true);
                return t;
            });
        }

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("qzark.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("Scheduler started (queue-based, no external cron).");
    }

    /**
     * Let the poller finish its current cycle, then wait for running commands to end on their own.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping...");
        wakeSignal.release();

        try {
            if (pollerThread != null) {
                pollerThread.join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            pollerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                Duration wait = props.getCommandTimeout().plus(STOP_GRACE);
                if (!workerPool.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Workers still busy after {}; interrupting", wait);
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        log.info("Scheduler stopped.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    /**
     * Start time of the last run per task name.
     */
    public Map<String, Instant> lastRuns() {
        return Map.copyOf(lastRun);
    }

    public Set<String> runningTasks() {
        return Set.copyOf(inFlight);
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    boolean isDue(Task task, Instant now) {
        Instant last = lastRun.get(task.name());
        return last == null || Duration.between(last, now).compareTo(task.interval()) >= 0;
    }

    private void seed() {
        store.verifyConnection();

        Set<String> queued = store.snapshot().stream()
                .map(Task::name)
                .collect(Collectors.toSet());

        int pushed = 0;
        for (Task task : tasks) {
            if (queued.contains(task.name())) {
                log.debug("Task '{}' already queued; keeping stored entry", task.name());
                continue;
            }
            store.push(task);
            pushed++;
        }
        log.info("Seeded task store pushed={} alreadyQueued={}", pushed, tasks.size() - pushed);
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                runCycle();
                storeErrorCount = 0;
            } catch (TaskStoreException e) {
                storeErrorCount++;
                log.error("Task store unavailable, skipping cycle attempt={} msg={}", storeErrorCount, e.getMessage(), e);
                if (!pause(backoff(storeErrorCount))) {
                    break;
                }
                continue;
            } catch (RuntimeException e) {
                log.error("Scheduler cycle failed msg={}", e.getMessage(), e);
            }

            if (!pause(props.getPollPause())) {
                break;
            }
        }
        log.debug("Scheduler poller exited");
    }

    /**
     * One poll cycle: pop, due-check, optional dispatch, requeue.
     */
    void runCycle() {
        flushPendingRequeue();

        Optional<Task> popped = store.pop();
        if (popped.isEmpty()) {
            log.debug("Task store is empty");
            return;
        }

        Task task = popped.get();
        try {
            evaluate(task);
        } finally {
            requeue(task);
        }
    }

    private void evaluate(Task task) {
        if (!isDue(task, nowInstant())) {
            log.debug("Task '{}' not due yet", task.name());
            return;
        }
        if (inFlight.contains(task.name())) {
            log.debug("Task '{}' is still running; skipping this cycle", task.name());
            return;
        }

        // last run is stamped only once a worker is free
        workerSem.acquireUninterruptibly();
        if (!inFlight.add(task.name())) {
            workerSem.release();
            return;
        }
        lastRun.put(task.name(), nowInstant());
        dispatch(task);
    }

    private void dispatch(Task task) {
        try {
            workerPool.submit(() -> {
                try {
                    execute(task);
                } finally {
                    inFlight.remove(task.name());
                    workerSem.release();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(task.name());
            workerSem.release();
            log.warn("Task '{}' rejected by worker pool msg={}", task.name(), e.getMessage());
        }
    }

    private void execute(Task task) {
        ExecutionResult result;
        try {
            result = executor.run(task);
        } catch (RuntimeException e) {
            log.error("Error running task '{}': {}", task.name(), e.getMessage(), e);
            result = ExecutionResult.failure(String.valueOf(e.getMessage()));
        }

        if (result.failed()) {
            fanout.notify(task.name(), result.errorMessage());
        }
    }

    private void requeue(Task task) {
        try {
            store.requeue(task);
        } catch (TaskStoreException e) {
            pendingRequeue.addLast(task);
            throw e;
        }
    }

    private void flushPendingRequeue() {
        while (!pendingRequeue.isEmpty()) {
            Task task = pendingRequeue.peekFirst();
            store.requeue(task);
            pendingRequeue.pollFirst();
            log.info("Task '{}' requeued after store recovery", task.name());
        }
    }

    /**
     * Waits for the given duration or until {@link #stop()} is called.
     *
     * @return false when the poller should exit
     */
    private boolean pause(Duration duration) {
        try {
            wakeSignal.tryAcquire(Math.max(0, duration.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return started.get();
    }

    // Exponential backoff for repeated store failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
