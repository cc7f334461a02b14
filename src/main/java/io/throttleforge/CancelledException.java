package io.throttleforge;

/**
 * Raised when a task is cancelled before completion, or its scheduler is closed
 * while the task is still queued or waiting.
 */
public class CancelledException extends RuntimeException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
