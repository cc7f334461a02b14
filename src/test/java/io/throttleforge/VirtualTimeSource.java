package io.throttleforge;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when someone sleeps on it, so quota windows and backoffs cost no real time.
 */
final class VirtualTimeSource implements TimeSource {

    private final AtomicLong now;
    private final List<Long> sleeps;

    VirtualTimeSource(long startMillis) {
        this.now = new AtomicLong(startMillis);
        this.sleeps = new CopyOnWriteArrayList<Long>();
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    @Override
    public void sleep(long millis, CancellationToken token) {
        token.throwIfCancelled();
        if (millis <= 0L) {
            return;
        }
        sleeps.add(millis);
        now.addAndGet(millis);
        token.throwIfCancelled();
    }

    void advance(long millis) {
        now.addAndGet(millis);
    }

    List<Long> sleeps() {
        return new ArrayList<Long>(sleeps);
    }

    long totalSlept() {
        long total = 0L;
        for (Long sleep : sleeps) {
            total += sleep;
        }
        return total;
    }
}
