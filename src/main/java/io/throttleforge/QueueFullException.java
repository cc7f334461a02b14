package io.throttleforge;

/**
 * Raised by {@code submit} when the queue is at capacity under {@link OverflowPolicy#REJECT}.
 */
public class QueueFullException extends RuntimeException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super("Admission queue is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
