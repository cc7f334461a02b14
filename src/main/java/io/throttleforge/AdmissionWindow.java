package io.throttleforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quota and spacing bookkeeping for one scheduler.
 *
 * <p>Not thread-safe: only the single consumer loop of the owning scheduler reads or writes it.
 */
final class AdmissionWindow {

    private static final Logger log = LoggerFactory.getLogger(AdmissionWindow.class);

    private final TimeSource timeSource;
    private final long periodMillis;
    private final int maxPerPeriod;
    private final long minIntervalMillis;

    private int count;
    private long windowResetAt;
    private long lastAdmissionAt;

    AdmissionWindow(TimeSource timeSource, long periodMillis, int maxPerPeriod, long minIntervalMillis) {
        this.timeSource = timeSource;
        this.periodMillis = periodMillis;
        this.maxPerPeriod = maxPerPeriod;
        this.minIntervalMillis = minIntervalMillis;
        this.count = 0;
        this.windowResetAt = timeSource.currentTimeMillis() + periodMillis;
        this.lastAdmissionAt = 0L;
    }

    /**
     * Blocks until the next admission respects both the per-period quota and the minimum spacing.
     *
     * @return true when the caller had to wait for either of them.
     */
    boolean awaitAdmission(CancellationToken token) throws InterruptedException {
        boolean waited = false;
        long now = timeSource.currentTimeMillis();
        if (now > windowResetAt) {
            resetAt(now);
            log.debug("Quota window reset");
        }

        if (count >= maxPerPeriod) {
            long wait = windowResetAt - now;
            log.info("Quota of {} calls per {}ms reached, waiting {}ms", maxPerPeriod, periodMillis, wait);
            waited = true;
            timeSource.sleep(wait, token);
            resetAt(timeSource.currentTimeMillis());
        }

        long sinceLast = timeSource.currentTimeMillis() - lastAdmissionAt;
        if (sinceLast < minIntervalMillis) {
            long wait = minIntervalMillis - sinceLast;
            log.debug("Waiting {}ms to keep calls spaced", wait);
            waited = true;
            timeSource.sleep(wait, token);
        }
        return waited;
    }

    /**
     * Counts one admission against the current window and restarts the spacing interval.
     */
    void recordAdmission() {
        lastAdmissionAt = timeSource.currentTimeMillis();
        count++;
    }

    int count() {
        return count;
    }

    long windowResetAt() {
        return windowResetAt;
    }

    long lastAdmissionAt() {
        return lastAdmissionAt;
    }

    private void resetAt(long now) {
        count = 0;
        windowResetAt = now + periodMillis;
    }
}
