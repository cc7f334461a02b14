package io.throttleforge;

/**
 * Failure taxonomy driving retry decisions.
 */
public enum ErrorKind {
    /** Downstream quota exceeded (HTTP 429 and friends); retried with a floored backoff. */
    RATE_LIMITED(true),
    /** Gateway errors and timeouts; retried with plain exponential backoff. */
    TRANSIENT(true),
    /** Validation, auth or malformed input; surfaced after the first attempt. */
    PERMANENT(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
