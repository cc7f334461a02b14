package io.throttleforge;

import java.time.Duration;

/**
 * Observability callbacks for the task lifecycle.
 *
 * <p>Callbacks for admission, retries and completion run on the consumer thread and delay
 * every task behind the current one; keep them short. {@code onQueued} runs on the submitting thread.
 */
public interface TaskHook {

    default void onQueued(TaskInfo info) {
    }

    /**
     * The task passed the quota and spacing checks and its first attempt is about to start.
     *
     * @param admittedAtMillis time of admission according to the scheduler's {@link TimeSource}.
     */
    default void onAdmitted(TaskInfo info, long admittedAtMillis) {
    }

    /**
     * Attempt {@code attempt} failed with a retryable error; the next attempt follows after {@code delay}.
     */
    default void onRetry(TaskInfo info, int attempt, ErrorKind kind, Throwable error, Duration delay) {
    }

    default void onSuccess(TaskInfo info, int attempts, Duration duration) {
    }

    default void onFailure(TaskInfo info, Throwable error, int attempts, Duration duration) {
    }

    default void onCancel(TaskInfo info) {
    }
}
