package io.qzark;

import io.qzark.core.Task;

import java.util.List;
import java.util.Optional;

/**
 * Ordered FIFO container holding every task between scheduling cycles.
 *
 * <p>Every task pushed at startup stays in the store for the lifetime of the scheduler:
 * {@link #pop()} takes one occurrence out and {@link #requeue(Task)} puts it back at the tail,
 * so over many cycles the store behaves as a round-robin rotation.
 *
 * <p>Backend failures are reported as {@link io.qzark.core.TaskStoreException}.
 */
public interface TaskStore {

    /**
     * Append a task to the tail. Used to seed the store at startup.
     */
    void push(Task task);

    /**
     * Remove and return the head task, or empty when the store holds nothing. Never blocks.
     */
    Optional<Task> pop();

    /**
     * Put a processed task back at the tail.
     */
    void requeue(Task task);

    /**
     * Current content in queue order. Does not modify the store.
     */
    List<Task> snapshot();

    default boolean contains(String name) {
        return snapshot().stream().anyMatch(t -> t.name().equals(name));
    }

    /**
     * Check that the backend is reachable. Called once before scheduling starts.
     */
    default void verifyConnection() {
    }
}
