package io.throttleforge;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry budget and backoff computation for downstream calls.
 *
 * <p>A policy is immutable and can be shared by any number of schedulers.
 *
 * <p>Delay before attempt {@code k + 1}, after attempt {@code k} failed:
 * {@code min(baseDelay * 2^(k-1) + jitter, maxDelay)}, where {@code jitter} is uniform in
 * {@code [0, jitterCeiling]}. Rate-limited failures never wait less than {@code rateLimitFloor}.
 */
public final class BackoffPolicy {

    /**
     * Source of the random jitter added to every delay.
     */
    public interface Jitter {
        /**
         * @return a value in {@code [0, ceilingMillis]}.
         */
        long nextMillis(long ceilingMillis);
    }

    private static final Jitter UNIFORM = new Jitter() {
        @Override
        public long nextMillis(long ceilingMillis) {
            if (ceilingMillis <= 0L) {
                return 0L;
            }
            return ThreadLocalRandom.current().nextLong(ceilingMillis + 1L);
        }
    };

    private static final BackoffPolicy DEFAULTS = builder().build();

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration jitterCeiling;
    private final Duration rateLimitFloor;
    private final ErrorClassifier classifier;
    private final Jitter jitter;

    private BackoffPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.jitterCeiling = builder.jitterCeiling;
        this.rateLimitFloor = builder.rateLimitFloor;
        this.classifier = builder.classifier;
        this.jitter = builder.jitter;
    }

    /**
     * 5 attempts, 1s base, 30s cap, up to 1s jitter, 10s rate-limit floor.
     */
    public static BackoffPolicy defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this policy's settings.
     */
    public Builder toBuilder() {
        return new Builder()
            .maxRetries(maxRetries)
            .baseDelay(baseDelay)
            .maxDelay(maxDelay)
            .jitterCeiling(jitterCeiling)
            .rateLimitFloor(rateLimitFloor)
            .classifier(classifier)
            .jitter(jitter);
    }

    /**
     * Max execution attempts, the first one included.
     */
    public int maxRetries() {
        return maxRetries;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public Duration jitterCeiling() {
        return jitterCeiling;
    }

    public Duration rateLimitFloor() {
        return rateLimitFloor;
    }

    public ErrorClassifier classifier() {
        return classifier;
    }

    public ErrorKind classify(Throwable failure) {
        ErrorKind kind = classifier.classify(failure);
        return kind == null ? ErrorKind.PERMANENT : kind;
    }

    /**
     * Delay in milliseconds before the attempt following failed attempt {@code attempt} (1-based).
     */
    public long nextDelayMillis(int attempt, ErrorKind kind) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be > 0");
        }
        Objects.requireNonNull(kind, "kind");
        long capMillis = maxDelay.toMillis();
        long delay = Math.min(exponentialMillis(attempt, capMillis) + jitterMillis(), capMillis);
        if (kind == ErrorKind.RATE_LIMITED) {
            delay = Math.max(delay, rateLimitFloor.toMillis());
        }
        return delay;
    }

    public Duration nextDelay(int attempt, ErrorKind kind) {
        return Duration.ofMillis(nextDelayMillis(attempt, kind));
    }

    private long exponentialMillis(int attempt, long capMillis) {
        int exponent = attempt - 1;
        double computed = baseDelay.toMillis() * Math.pow(2.0d, exponent);
        if (Double.isInfinite(computed) || computed >= capMillis) {
            return capMillis;
        }
        return (long) computed;
    }

    private long jitterMillis() {
        long ceiling = jitterCeiling.toMillis();
        long value = jitter.nextMillis(ceiling);
        if (value < 0L) {
            return 0L;
        }
        return Math.min(value, ceiling);
    }

    public static final class Builder {
        private int maxRetries = 5;
        private Duration baseDelay = Duration.ofMillis(1000L);
        private Duration maxDelay = Duration.ofMillis(30000L);
        private Duration jitterCeiling = Duration.ofMillis(1000L);
        private Duration rateLimitFloor = Duration.ofMillis(10000L);
        private ErrorClassifier classifier = ErrorClassifiers.defaults();
        private Jitter jitter = UNIFORM;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries <= 0) {
                throw new IllegalArgumentException("maxRetries must be > 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = nonNegative(baseDelay, "baseDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("maxDelay must be > 0");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitterCeiling(Duration jitterCeiling) {
            this.jitterCeiling = nonNegative(jitterCeiling, "jitterCeiling");
            return this;
        }

        public Builder rateLimitFloor(Duration rateLimitFloor) {
            this.rateLimitFloor = nonNegative(rateLimitFloor, "rateLimitFloor");
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        public Builder jitter(Jitter jitter) {
            this.jitter = Objects.requireNonNull(jitter, "jitter");
            return this;
        }

        /**
         * Removes the random component; mostly useful in tests.
         */
        public Builder noJitter() {
            return jitterCeiling(Duration.ZERO);
        }

        public BackoffPolicy build() {
            return new BackoffPolicy(this);
        }

        private static Duration nonNegative(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative()) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
            return value;
        }
    }
}
