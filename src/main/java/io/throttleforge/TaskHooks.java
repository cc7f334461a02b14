package io.throttleforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Combinators for {@link TaskHook}.
 */
public final class TaskHooks {

    private static final Logger log = LoggerFactory.getLogger(TaskHooks.class);

    static final TaskHook NOOP = new TaskHook() {
    };

    private TaskHooks() {
    }

    /**
     * Calls {@code left} then {@code right} for every event. A hook that throws is logged
     * and does not prevent the other one from running.
     */
    public static TaskHook compose(final TaskHook left, final TaskHook right) {
        final TaskHook first = guarded(left);
        final TaskHook second = guarded(right);
        return new TaskHook() {
            @Override
            public void onQueued(TaskInfo info) {
                first.onQueued(info);
                second.onQueued(info);
            }

            @Override
            public void onAdmitted(TaskInfo info, long admittedAtMillis) {
                first.onAdmitted(info, admittedAtMillis);
                second.onAdmitted(info, admittedAtMillis);
            }

            @Override
            public void onRetry(TaskInfo info, int attempt, ErrorKind kind, Throwable error, Duration delay) {
                first.onRetry(info, attempt, kind, error, delay);
                second.onRetry(info, attempt, kind, error, delay);
            }

            @Override
            public void onSuccess(TaskInfo info, int attempts, Duration duration) {
                first.onSuccess(info, attempts, duration);
                second.onSuccess(info, attempts, duration);
            }

            @Override
            public void onFailure(TaskInfo info, Throwable error, int attempts, Duration duration) {
                first.onFailure(info, error, attempts, duration);
                second.onFailure(info, error, attempts, duration);
            }

            @Override
            public void onCancel(TaskInfo info) {
                first.onCancel(info);
                second.onCancel(info);
            }
        };
    }

    /**
     * Wraps a hook so that anything it throws is logged at WARN instead of reaching the consumer loop.
     */
    static TaskHook guarded(final TaskHook hook) {
        if (hook == null || hook == NOOP) {
            return NOOP;
        }
        if (hook instanceof GuardedHook) {
            return hook;
        }
        return new GuardedHook(hook);
    }

    private static final class GuardedHook implements TaskHook {

        private final TaskHook delegate;

        private GuardedHook(TaskHook delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onQueued(TaskInfo info) {
            try {
                delegate.onQueued(info);
            } catch (RuntimeException e) {
                warn("onQueued", info, e);
            }
        }

        @Override
        public void onAdmitted(TaskInfo info, long admittedAtMillis) {
            try {
                delegate.onAdmitted(info, admittedAtMillis);
            } catch (RuntimeException e) {
                warn("onAdmitted", info, e);
            }
        }

        @Override
        public void onRetry(TaskInfo info, int attempt, ErrorKind kind, Throwable error, Duration delay) {
            try {
                delegate.onRetry(info, attempt, kind, error, delay);
            } catch (RuntimeException e) {
                warn("onRetry", info, e);
            }
        }

        @Override
        public void onSuccess(TaskInfo info, int attempts, Duration duration) {
            try {
                delegate.onSuccess(info, attempts, duration);
            } catch (RuntimeException e) {
                warn("onSuccess", info, e);
            }
        }

        @Override
        public void onFailure(TaskInfo info, Throwable error, int attempts, Duration duration) {
            try {
                delegate.onFailure(info, error, attempts, duration);
            } catch (RuntimeException e) {
                warn("onFailure", info, e);
            }
        }

        @Override
        public void onCancel(TaskInfo info) {
            try {
                delegate.onCancel(info);
            } catch (RuntimeException e) {
                warn("onCancel", info, e);
            }
        }

        private static void warn(String callback, TaskInfo info, RuntimeException e) {
            log.warn("Task hook {} failed for {}", callback, info, e);
        }
    }
}
