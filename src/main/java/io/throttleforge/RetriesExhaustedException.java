package io.throttleforge;

/**
 * Terminal failure after every allowed attempt failed. The last failure is the cause.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;
    private final String lastErrorMessage;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("Max retries (" + attempts + ") exceeded. Last error: " + messageOf(lastFailure), lastFailure);
        this.attempts = attempts;
        this.lastErrorMessage = messageOf(lastFailure);
    }

    public int attempts() {
        return attempts;
    }

    public String lastErrorMessage() {
        return lastErrorMessage;
    }

    private static String messageOf(Throwable failure) {
        if (failure == null) {
            return "unknown";
        }
        String message = failure.getMessage();
        return message == null ? failure.getClass().getName() : message;
    }
}
