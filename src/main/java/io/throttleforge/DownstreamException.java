package io.throttleforge;

import java.util.Objects;

/**
 * Structured failure an operation raises so the scheduler can classify it exactly
 * instead of guessing from the message.
 */
public class DownstreamException extends RuntimeException {

    /** Marker for failures that did not come with a status code. */
    public static final int NO_STATUS = -1;

    private final ErrorKind kind;
    private final int statusCode;

    public DownstreamException(ErrorKind kind, String message) {
        this(kind, NO_STATUS, message, null);
    }

    public DownstreamException(ErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.statusCode = statusCode;
    }

    public static DownstreamException rateLimited(String message) {
        return new DownstreamException(ErrorKind.RATE_LIMITED, 429, message, null);
    }

    public static DownstreamException transientFailure(String message) {
        return new DownstreamException(ErrorKind.TRANSIENT, message);
    }

    public static DownstreamException permanent(String message) {
        return new DownstreamException(ErrorKind.PERMANENT, message);
    }

    /**
     * Maps an HTTP status to a kind: 429 is rate limiting, 502/503/504 are transient,
     * anything else is permanent.
     */
    public static DownstreamException fromStatus(int statusCode, String message) {
        return new DownstreamException(kindOf(statusCode), statusCode, message, null);
    }

    public ErrorKind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_STATUS;
    }

    static ErrorKind kindOf(int statusCode) {
        switch (statusCode) {
            case 429:
                return ErrorKind.RATE_LIMITED;
            case 502:
            case 503:
            case 504:
                return ErrorKind.TRANSIENT;
            default:
                return ErrorKind.PERMANENT;
        }
    }
}
