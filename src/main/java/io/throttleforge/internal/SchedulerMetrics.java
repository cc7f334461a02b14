package io.throttleforge.internal;

import io.throttleforge.SchedulerMetricsSnapshot;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Low-overhead counters for one scheduler. Submitting threads and the consumer thread
 * record concurrently; {@link #snapshot()} never blocks either of them.
 */
public final class SchedulerMetrics {

    private final LongAdder submitted;
    private final LongAdder rejected;
    private final LongAdder admitted;
    private final LongAdder succeeded;
    private final LongAdder failed;
    private final LongAdder cancelled;
    private final LongAdder retries;
    private final LongAdder windowWaits;
    private final LongAdder totalDurationNanos;
    private final AtomicLong maxDurationNanos;

    public SchedulerMetrics() {
        this.submitted = new LongAdder();
        this.rejected = new LongAdder();
        this.admitted = new LongAdder();
        this.succeeded = new LongAdder();
        this.failed = new LongAdder();
        this.cancelled = new LongAdder();
        this.retries = new LongAdder();
        this.windowWaits = new LongAdder();
        this.totalDurationNanos = new LongAdder();
        this.maxDurationNanos = new AtomicLong(0L);
    }

    public void recordSubmitted() {
        submitted.increment();
    }

    public void recordRejected() {
        rejected.increment();
    }

    public void recordAdmitted() {
        admitted.increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordWindowWait() {
        windowWaits.increment();
    }

    public void recordCancelled() {
        cancelled.increment();
    }

    public void recordSuccess(long durationNanos) {
        succeeded.increment();
        recordDuration(durationNanos);
    }

    public void recordFailure(long durationNanos) {
        failed.increment();
        recordDuration(durationNanos);
    }

    public SchedulerMetricsSnapshot snapshot() {
        return new SchedulerMetricsSnapshot(
            submitted.sum(),
            rejected.sum(),
            admitted.sum(),
            succeeded.sum(),
            failed.sum(),
            cancelled.sum(),
            retries.sum(),
            windowWaits.sum(),
            totalDurationNanos.sum(),
            maxDurationNanos.get()
        );
    }

    private void recordDuration(long durationNanos) {
        long safeDuration = Math.max(0L, durationNanos);
        totalDurationNanos.add(safeDuration);
        long current = maxDurationNanos.get();
        while (safeDuration > current) {
            if (maxDurationNanos.compareAndSet(current, safeDuration)) {
                return;
            }
            current = maxDurationNanos.get();
        }
    }
}
