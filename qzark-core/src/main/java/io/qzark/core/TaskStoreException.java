package io.qzark.core;

/**
 * Raised when a task store backend cannot be reached or rejects an operation.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
