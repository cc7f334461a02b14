package io.throttleforge.internal;

import io.throttleforge.CancelledException;
import io.throttleforge.CancellationToken;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token that is cancelled either directly or through its parent.
 *
 * <p>Each task owns one of these with the scheduler-wide token as parent, so closing the
 * scheduler reaches every task without walking the queue.
 */
public final class DefaultCancellationToken implements CancellationToken {

    private static final Runnable NOOP = new Runnable() {
        @Override
        public void run() {
        }
    };

    private final CancellationToken parent;
    private final AtomicBoolean cancelled;
    private final Runnable onCancel;
    private final String message;

    public DefaultCancellationToken(String message) {
        this(null, NOOP, message);
    }

    public DefaultCancellationToken(CancellationToken parent, Runnable onCancel, String message) {
        this.parent = parent;
        this.cancelled = new AtomicBoolean(false);
        this.onCancel = onCancel == null ? NOOP : onCancel;
        this.message = message;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            onCancel.run();
        }
    }

    @Override
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancelledException(message);
        }
        if (parent != null) {
            parent.throwIfCancelled();
        }
    }
}
