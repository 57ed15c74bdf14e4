package io.qzark.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable task definition: a named shell command repeated on a fixed interval.
 * Created once when task definitions are loaded and never mutated afterwards.
 */
public record Task(
        String name,
        Duration interval,
        String command
) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);

    public Task {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(command, "command must not be null");
        if (command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        if (interval == null) {
            interval = DEFAULT_INTERVAL;
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration: " + interval);
        }
    }

    public static Task of(String name, long intervalSeconds, String command) {
        return new Task(name, Duration.ofSeconds(intervalSeconds), command);
    }

    public long intervalSeconds() {
        return interval.toSeconds();
    }
}
