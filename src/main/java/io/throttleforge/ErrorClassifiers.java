package io.throttleforge;

import java.util.Locale;

/**
 * Stock {@link ErrorClassifier} implementations.
 */
public final class ErrorClassifiers {

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final String[] RATE_LIMIT_MARKERS = {"429", "quota", "rate limit", "rate_limit_exceeded"};
    private static final String[] TRANSIENT_MARKERS = {"502", "503", "timeout", "timed out"};

    private static final ErrorClassifier STRUCTURED = new ErrorClassifier() {
        @Override
        public ErrorKind classify(Throwable failure) {
            ErrorKind kind = structuredKind(failure);
            return kind == null ? ErrorKind.PERMANENT : kind;
        }
    };

    private static final ErrorClassifier MESSAGE_HEURISTICS = new ErrorClassifier() {
        @Override
        public ErrorKind classify(Throwable failure) {
            ErrorKind kind = messageKind(failure);
            return kind == null ? ErrorKind.PERMANENT : kind;
        }
    };

    private static final ErrorClassifier DEFAULTS = new ErrorClassifier() {
        @Override
        public ErrorKind classify(Throwable failure) {
            ErrorKind kind = structuredKind(failure);
            if (kind != null) {
                return kind;
            }
            kind = messageKind(failure);
            return kind == null ? ErrorKind.PERMANENT : kind;
        }
    };

    private ErrorClassifiers() {
    }

    /**
     * Exact classification: {@link DownstreamException} reports its own kind, timeout
     * exception types are transient, everything else is permanent.
     */
    public static ErrorClassifier structured() {
        return STRUCTURED;
    }

    /**
     * Substring matching on failure messages, for downstream clients that only report
     * errors as text. Rate-limit markers win over transient ones.
     */
    public static ErrorClassifier messageHeuristics() {
        return MESSAGE_HEURISTICS;
    }

    /**
     * {@link #structured()} first; message heuristics only for failures that carry no structure.
     */
    public static ErrorClassifier defaults() {
        return DEFAULTS;
    }

    private static ErrorKind structuredKind(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof DownstreamException) {
                return ((DownstreamException) current).kind();
            }
            if (isTimeout(current)) {
                return ErrorKind.TRANSIENT;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ErrorKind messageKind(Throwable failure) {
        boolean transientSeen = false;
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            String message = current.getMessage();
            if (message != null) {
                String normalized = message.toLowerCase(Locale.ROOT);
                if (containsAny(normalized, RATE_LIMIT_MARKERS)) {
                    return ErrorKind.RATE_LIMITED;
                }
                if (containsAny(normalized, TRANSIENT_MARKERS)) {
                    transientSeen = true;
                }
            }
            current = current.getCause();
        }
        return transientSeen ? ErrorKind.TRANSIENT : null;
    }

    // java.util.concurrent.TimeoutException, java.net.SocketTimeoutException, HttpTimeoutException...
    private static boolean isTimeout(Throwable failure) {
        return failure.getClass().getSimpleName().endsWith("TimeoutException");
    }

    private static boolean containsAny(String text, String[] markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
