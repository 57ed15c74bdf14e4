package io.qzark;

import io.qzark.core.ExecutionResult;
import io.qzark.core.Task;

/**
 * Runs a task's command once and classifies the outcome. Implementations never throw for a
 * failing command; every failure is expressed as a failed {@link ExecutionResult}.
 */
public interface TaskExecutor {

    ExecutionResult run(Task task);
}
