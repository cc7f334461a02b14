package io.throttleforge;

/**
 * Raised by {@link Task#await(java.time.Duration)} when the task did not finish in time.
 * The task keeps its place in the queue.
 */
public class TaskTimeoutException extends RuntimeException {

    public TaskTimeoutException(String message) {
        super(message);
    }
}
