package io.throttleforge;

/**
 * Cooperative cancellation signal checked at every suspension point of the consumer loop
 * (quota window wait, spacing wait, backoff wait).
 * Implementations must be thread-safe.
 */
public interface CancellationToken {

    /**
     * @return true when this token, or the scheduler it belongs to, has been cancelled.
     */
    boolean isCancelled();

    /**
     * Requests cancellation. Repeated calls have no further effect.
     */
    void cancel();

    /**
     * Throws {@link CancelledException} if cancellation has been requested.
     */
    void throwIfCancelled();
}
