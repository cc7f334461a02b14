package io.throttleforge;

/**
 * Clock and sleeper used by the admission window and the retry executor.
 *
 * <p>All timing decisions of a scheduler go through one instance, which lets tests
 * substitute a virtual clock for the 60-second quota window and 10-second rate-limit floors.
 */
public interface TimeSource {

    /**
     * Current time in epoch milliseconds.
     */
    long currentTimeMillis();

    /**
     * Suspends the calling thread for {@code millis}, giving up early with
     * {@link CancelledException} once {@code token} is cancelled.
     */
    void sleep(long millis, CancellationToken token) throws InterruptedException;

    /**
     * Wall clock backed by {@link System#currentTimeMillis()} and {@link Thread#sleep(long)}.
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    final class SystemTimeSource implements TimeSource {

        private static final SystemTimeSource INSTANCE = new SystemTimeSource();
        private static final long SLICE_MILLIS = 100L;

        private SystemTimeSource() {
        }

        @Override
        public long currentTimeMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleep(long millis, CancellationToken token) throws InterruptedException {
            if (millis <= 0L) {
                return;
            }
            long remainingMillis = millis;
            while (remainingMillis > 0L) {
                token.throwIfCancelled();
                long chunk = Math.min(remainingMillis, SLICE_MILLIS);
                Thread.sleep(chunk);
                remainingMillis -= chunk;
            }
            token.throwIfCancelled();
        }
    }
}
