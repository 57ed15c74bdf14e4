package io.qzark.internal;

import io.qzark.TaskExecutor;
import io.qzark.core.ExecutionResult;
import io.qzark.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs task commands through {@code /bin/sh -c} with a hard wall-clock limit.
 *
 * <p>stdout and stderr are drained on separate threads while the process runs, so a chatty
 * command cannot block on a full pipe.
 */
public class ShellTaskExecutor implements TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(ShellTaskExecutor.class);

    private static final Duration DRAIN_GRACE = Duration.ofSeconds(5);

    private final Duration timeout;
    private final List<String> shell;
    private final ExecutorService drainPool;

    public ShellTaskExecutor(Duration timeout) {
        this(timeout, List.of("/bin/sh", "-c"));
    }

    public ShellTaskExecutor(Duration timeout, List<String> shell) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        this.shell = List.copyOf(shell);
        this.drainPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("qzark.outputDrain");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ExecutionResult run(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        log.info("Running task '{}': {}", task.name(), task.command());

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(commandLine(task.command()));
            process = pb.start();
        } catch (IOException | RuntimeException e) {
            log.error("Task '{}' could not be started: {}", task.name(), e.getMessage());
            return ExecutionResult.failure("failed to start process: " + e.getMessage());
        }

        closeStdin(process);
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            log.warn("Task '{}' interrupted while running", task.name());
            return ExecutionResult.failure("execution interrupted");
        }

        if (!finished) {
            destroyTree(process);
            log.error("Task '{}' timed out after {}s", task.name(), timeout.toSeconds());
            return ExecutionResult.failure("execution timed out after " + timeout.toSeconds() + "s");
        }

        ExecutionResult result = ExecutionResult.fromExit(process.exitValue(), collect(stdout), collect(stderr));
        if (result.succeeded()) {
            log.info("Task '{}' completed successfully.", task.name());
        } else {
            log.error("Task '{}' failed with code {}: {}", task.name(), result.exitCode(), result.errorMessage());
        }
        return result;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private List<String> commandLine(String command) {
        List<String> cmd = new ArrayList<>(shell);
        cmd.add(command);
        return cmd;
    }

    private CompletableFuture<String> drain(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (in) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, drainPool);
    }

    private String collect(CompletableFuture<String> output) {
        try {
            return output.get(DRAIN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (Exception e) {
            log.debug("Could not collect process output msg={}", e.getMessage());
            return "";
        }
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close process stdin msg={}", e.getMessage());
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
