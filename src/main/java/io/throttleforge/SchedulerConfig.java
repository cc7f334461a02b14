package io.throttleforge;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Admission and retry settings of one {@link AdmissionScheduler}, fixed at construction.
 *
 * <p>Defaults: 15 calls per 60s window, 2s between calls, 5 attempts per call with 1s base
 * backoff capped at 30s, up to 1s jitter, 10s minimum wait after a rate-limit error,
 * and at most 10 000 queued tasks (further submissions rejected).
 *
 * <p>Properties form, all keys optional:
 * <pre>
 * throttleforge.period-ms=60000
 * throttleforge.max-per-period=15
 * throttleforge.min-interval-ms=2000
 * throttleforge.max-retries=5
 * throttleforge.base-delay-ms=1000
 * throttleforge.max-delay-ms=30000
 * throttleforge.rate-limit-floor-ms=10000
 * throttleforge.jitter-ceiling-ms=1000
 * throttleforge.queue-capacity=10000
 * throttleforge.overflow-policy=REJECT
 * </pre>
 */
public final class SchedulerConfig {

    public static final String PREFIX = "throttleforge.";

    private static final SchedulerConfig DEFAULTS = builder().build();

    private final Duration period;
    private final int maxPerPeriod;
    private final Duration minInterval;
    private final int queueCapacity;
    private final OverflowPolicy overflowPolicy;
    private final BackoffPolicy backoffPolicy;

    private SchedulerConfig(Builder builder) {
        this.period = builder.period;
        this.maxPerPeriod = builder.maxPerPeriod;
        this.minInterval = builder.minInterval;
        this.queueCapacity = builder.queueCapacity;
        this.overflowPolicy = builder.overflowPolicy;
        this.backoffPolicy = builder.backoff.build();
    }

    public static SchedulerConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code throttleforge.*} keys; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException naming the key when a value is malformed or out of range
     */
    public static SchedulerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String value;

        if ((value = read(properties, "period-ms")) != null) {
            builder.period(Duration.ofMillis(parsePositive("period-ms", value)));
        }
        if ((value = read(properties, "max-per-period")) != null) {
            builder.maxPerPeriod((int) parsePositive("max-per-period", value));
        }
        if ((value = read(properties, "min-interval-ms")) != null) {
            builder.minInterval(Duration.ofMillis(parseNonNegative("min-interval-ms", value)));
        }
        if ((value = read(properties, "max-retries")) != null) {
            builder.maxRetries((int) parsePositive("max-retries", value));
        }
        if ((value = read(properties, "base-delay-ms")) != null) {
            builder.baseDelay(Duration.ofMillis(parseNonNegative("base-delay-ms", value)));
        }
        if ((value = read(properties, "max-delay-ms")) != null) {
            builder.maxDelay(Duration.ofMillis(parsePositive("max-delay-ms", value)));
        }
        if ((value = read(properties, "rate-limit-floor-ms")) != null) {
            builder.rateLimitFloor(Duration.ofMillis(parseNonNegative("rate-limit-floor-ms", value)));
        }
        if ((value = read(properties, "jitter-ceiling-ms")) != null) {
            builder.jitterCeiling(Duration.ofMillis(parseNonNegative("jitter-ceiling-ms", value)));
        }
        if ((value = read(properties, "queue-capacity")) != null) {
            builder.queueCapacity((int) parsePositive("queue-capacity", value));
        }
        if ((value = read(properties, "overflow-policy")) != null) {
            builder.overflowPolicy(parseOverflowPolicy(value));
        }
        return builder.build();
    }

    /**
     * Loads a properties file from the classpath and applies {@link #fromProperties(Properties)}.
     *
     * @throws IllegalArgumentException when the resource does not exist
     * @throws UncheckedIOException when it cannot be read
     */
    public static SchedulerConfig load(String classpathResource) {
        Objects.requireNonNull(classpathResource, "classpathResource");
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SchedulerConfig.class.getClassLoader();
        }
        InputStream in = loader.getResourceAsStream(classpathResource);
        if (in == null) {
            throw new IllegalArgumentException("Configuration resource not found: " + classpathResource);
        }
        Properties properties = new Properties();
        try {
            try {
                properties.load(in);
            } finally {
                in.close();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration resource " + classpathResource, e);
        }
        return fromProperties(properties);
    }

    /**
     * Length of the quota window.
     */
    public Duration period() {
        return period;
    }

    /**
     * Admissions allowed per window.
     */
    public int maxPerPeriod() {
        return maxPerPeriod;
    }

    /**
     * Minimum time between two consecutive admissions.
     */
    public Duration minInterval() {
        return minInterval;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public OverflowPolicy overflowPolicy() {
        return overflowPolicy;
    }

    public BackoffPolicy backoffPolicy() {
        return backoffPolicy;
    }

    public Builder toBuilder() {
        return builder()
            .period(period)
            .maxPerPeriod(maxPerPeriod)
            .minInterval(minInterval)
            .queueCapacity(queueCapacity)
            .overflowPolicy(overflowPolicy)
            .backoffPolicy(backoffPolicy);
    }

    @Override
    public String toString() {
        return "SchedulerConfig{"
            + "period=" + period.toMillis() + "ms"
            + ", maxPerPeriod=" + maxPerPeriod
            + ", minInterval=" + minInterval.toMillis() + "ms"
            + ", maxRetries=" + backoffPolicy.maxRetries()
            + ", baseDelay=" + backoffPolicy.baseDelay().toMillis() + "ms"
            + ", maxDelay=" + backoffPolicy.maxDelay().toMillis() + "ms"
            + ", rateLimitFloor=" + backoffPolicy.rateLimitFloor().toMillis() + "ms"
            + ", jitterCeiling=" + backoffPolicy.jitterCeiling().toMillis() + "ms"
            + ", queueCapacity=" + queueCapacity
            + ", overflowPolicy=" + overflowPolicy
            + "}";
    }

    private static String read(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static long parsePositive(String key, String value) {
        long parsed = parseLong(key, value);
        if (parsed <= 0L) {
            throw new IllegalArgumentException(PREFIX + key + " must be > 0: " + value);
        }
        if (!key.endsWith("-ms") && parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(PREFIX + key + " is out of range: " + value);
        }
        return parsed;
    }

    private static long parseNonNegative(String key, String value) {
        long parsed = parseLong(key, value);
        if (parsed < 0L) {
            throw new IllegalArgumentException(PREFIX + key + " must be >= 0: " + value);
        }
        return parsed;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + value, e);
        }
    }

    private static OverflowPolicy parseOverflowPolicy(String value) {
        try {
            return OverflowPolicy.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(PREFIX + "overflow-policy must be REJECT or BLOCK: " + value, e);
        }
    }

    public static final class Builder {
        private Duration period = Duration.ofSeconds(60);
        private int maxPerPeriod = 15;
        private Duration minInterval = Duration.ofMillis(2000L);
        private int queueCapacity = 10000;
        private OverflowPolicy overflowPolicy = OverflowPolicy.REJECT;
        private BackoffPolicy.Builder backoff = BackoffPolicy.builder();

        private Builder() {
        }

        public Builder period(Duration period) {
            Objects.requireNonNull(period, "period");
            if (period.isNegative() || period.isZero()) {
                throw new IllegalArgumentException("period must be > 0");
            }
            this.period = period;
            return this;
        }

        public Builder maxPerPeriod(int maxPerPeriod) {
            if (maxPerPeriod <= 0) {
                throw new IllegalArgumentException("maxPerPeriod must be > 0");
            }
            this.maxPerPeriod = maxPerPeriod;
            return this;
        }

        public Builder minInterval(Duration minInterval) {
            Objects.requireNonNull(minInterval, "minInterval");
            if (minInterval.isNegative()) {
                throw new IllegalArgumentException("minInterval must be >= 0");
            }
            this.minInterval = minInterval;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("queueCapacity must be > 0");
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
            return this;
        }

        /**
         * Replaces every retry setting with those of {@code policy}.
         */
        public Builder backoffPolicy(BackoffPolicy policy) {
            Objects.requireNonNull(policy, "policy");
            this.backoff = policy.toBuilder();
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            backoff.maxRetries(maxRetries);
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            backoff.baseDelay(baseDelay);
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            backoff.maxDelay(maxDelay);
            return this;
        }

        public Builder rateLimitFloor(Duration rateLimitFloor) {
            backoff.rateLimitFloor(rateLimitFloor);
            return this;
        }

        public Builder jitterCeiling(Duration jitterCeiling) {
            backoff.jitterCeiling(jitterCeiling);
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            backoff.classifier(classifier);
            return this;
        }

        public Builder jitter(BackoffPolicy.Jitter jitter) {
            backoff.jitter(jitter);
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
