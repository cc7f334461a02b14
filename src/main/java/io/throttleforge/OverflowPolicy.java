package io.throttleforge;

/**
 * What {@code submit} does when the admission queue is at capacity.
 */
public enum OverflowPolicy {
    /** Fail the submission immediately with {@link QueueFullException}. */
    REJECT,
    /** Block the submitting thread until a queued task is admitted or cancelled. */
    BLOCK
}
