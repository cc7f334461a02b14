package io.throttleforge;

import java.time.Duration;

/**
 * Immutable point-in-time view of a scheduler's counters.
 *
 * <p>Durations cover execution only (all attempts and backoff waits of a task), not time
 * spent queued or waiting for admission.
 */
public final class SchedulerMetricsSnapshot {

    private final long submitted;
    private final long rejected;
    private final long admitted;
    private final long succeeded;
    private final long failed;
    private final long cancelled;
    private final long retries;
    private final long windowWaits;
    private final long totalDurationNanos;
    private final long maxDurationNanos;

    public SchedulerMetricsSnapshot(
        long submitted,
        long rejected,
        long admitted,
        long succeeded,
        long failed,
        long cancelled,
        long retries,
        long windowWaits,
        long totalDurationNanos,
        long maxDurationNanos
    ) {
        this.submitted = submitted;
        this.rejected = rejected;
        this.admitted = admitted;
        this.succeeded = succeeded;
        this.failed = failed;
        this.cancelled = cancelled;
        this.retries = retries;
        this.windowWaits = windowWaits;
        this.totalDurationNanos = totalDurationNanos;
        this.maxDurationNanos = maxDurationNanos;
    }

    public long submitted() {
        return submitted;
    }

    /**
     * Submissions refused because the queue was full.
     */
    public long rejected() {
        return rejected;
    }

    public long admitted() {
        return admitted;
    }

    public long succeeded() {
        return succeeded;
    }

    public long failed() {
        return failed;
    }

    public long cancelled() {
        return cancelled;
    }

    /**
     * Backoff waits across all tasks, i.e. attempts beyond the first one that were scheduled.
     */
    public long retries() {
        return retries;
    }

    /**
     * Times the consumer had to pause for the quota window or the minimum spacing.
     */
    public long windowWaits() {
        return windowWaits;
    }

    public long completed() {
        return succeeded + failed + cancelled;
    }

    public Duration totalDuration() {
        return Duration.ofNanos(totalDurationNanos);
    }

    public Duration averageDuration() {
        long executed = succeeded + failed;
        if (executed == 0L) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(totalDurationNanos / executed);
    }

    public Duration maxDuration() {
        return Duration.ofNanos(maxDurationNanos);
    }

    @Override
    public String toString() {
        Duration avg = averageDuration();
        Duration max = maxDuration();

        StringBuilder sb = new StringBuilder(256);
        sb.append("SchedulerMetricsSnapshot{");
        sb.append("submitted=").append(submitted);
        sb.append(", rejected=").append(rejected);
        sb.append(", admitted=").append(admitted);
        sb.append(", succeeded=").append(succeeded);
        sb.append(", failed=").append(failed);
        sb.append(", cancelled=").append(cancelled);
        sb.append(", retries=").append(retries);
        sb.append(", windowWaits=").append(windowWaits);
        sb.append(", averageDuration=").append(avg.toMillis()).append("ms");
        sb.append(", maxDuration=").append(max.toMillis()).append("ms");
        sb.append("}");
        return sb.toString();
    }
}
