package io.throttleforge;

/**
 * Raised from {@link Task#await()} when the operation ended with a checked exception.
 * The original failure is available as the cause.
 */
public class TaskExecutionException extends RuntimeException {

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
