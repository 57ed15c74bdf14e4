package io.qzark.core;

/**
 * A task record that cannot be turned into a {@link Task}.
 */
public class TaskDefinitionException extends Exception {

    public TaskDefinitionException(String message) {
        super(message);
    }

    public TaskDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
