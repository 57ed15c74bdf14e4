package io.qzark.internal;

import io.qzark.TaskStore;
import io.qzark.core.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local FIFO task store. Content is lost when the process exits.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentLinkedQueue<Task> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void push(Task task) {
        queue.offer(Objects.requireNonNull(task, "task must not be null"));
    }

    @Override
    public Optional<Task> pop() {
        return Optional.ofNullable(queue.poll());
    }

    @Override
    public void requeue(Task task) {
        push(task);
    }

    @Override
    public List<Task> snapshot() {
        return new ArrayList<>(queue);
    }
}
