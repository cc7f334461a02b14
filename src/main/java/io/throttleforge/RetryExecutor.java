package io.throttleforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    /**
     * Receives per-attempt events; intermediate failures are never surfaced to the caller.
     */
    interface AttemptObserver {
        void onAttempt(int attempt);

        void onRetry(int attempt, ErrorKind kind, Throwable failure, long delayMillis);
    }

    private RetryExecutor() {
    }

    /**
     * Runs {@code operation} until it succeeds, fails with a non-retryable error, or
     * {@code policy.maxRetries()} attempts have failed.
     *
     * @throws RetriesExhaustedException when the last allowed attempt failed, whatever its kind
     */
    static <T> T execute(
        Operation<T> operation,
        BackoffPolicy policy,
        TimeSource timeSource,
        CancellationToken token,
        AttemptObserver observer
    ) throws Exception {
        int attempt = 0;
        int maxRetries = policy.maxRetries();

        while (true) {
            token.throwIfCancelled();
            attempt++;
            observer.onAttempt(attempt);
            log.debug("Downstream call attempt {}/{}", attempt, maxRetries);
            try {
                T result = operation.run(token);
                log.debug("Downstream call succeeded on attempt {}", attempt);
                return result;
            } catch (InterruptedException interruptedException) {
                throw interruptedException;
            } catch (CancelledException cancelledException) {
                throw cancelledException;
            } catch (Exception failure) {
                ErrorKind kind = policy.classify(failure);
                log.warn("Downstream call failed (attempt {}, {}): {}", attempt, kind, failure.getMessage());

                if (attempt >= maxRetries) {
                    throw new RetriesExhaustedException(attempt, failure);
                }
                if (!kind.isRetryable()) {
                    throw failure;
                }

                long delay = policy.nextDelayMillis(attempt, kind);
                if (kind == ErrorKind.RATE_LIMITED) {
                    log.info("Rate limit detected, waiting {}ms before retry", delay);
                } else {
                    log.info("Retrying in {}ms", delay);
                }
                observer.onRetry(attempt, kind, failure, delay);
                timeSource.sleep(delay, token);
            }
        }
    }
}
