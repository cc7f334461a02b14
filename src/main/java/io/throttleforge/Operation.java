package io.throttleforge;

/**
 * Zero-argument unit of downstream work. It may be invoked several times when it fails with
 * a retryable error, so it should be safe to repeat.
 *
 * <p>The token is cancelled when the task is cancelled or the scheduler closes; long-running
 * operations may poll it, the scheduler never interrupts a call in flight.
 */
public interface Operation<T> {

    T run(CancellationToken token) throws Exception;
}
