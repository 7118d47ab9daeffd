package com.store.connection.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter.
 *
 * <p>{@code delay(n) = min(baseDelay * multiplier^n, maxDelay)}. With jitter enabled the
 * value is perturbed by a uniform draw within +/-25% of itself. The result is never
 * shorter than {@link #MIN_DELAY}. Instances are immutable and thread-safe.</p>
 */
public final class BackoffPolicy {

    public static final Duration MIN_DELAY = Duration.ofMillis(100);

    private static final double JITTER_FRACTION = 0.25;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final boolean jitterEnabled;
    private final Random random;

    private BackoffPolicy(Builder builder) {
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.jitterEnabled = builder.jitterEnabled;
        this.random = builder.random;
    }

    /**
     * 1s base, 30s cap, doubling, jitter on.
     */
    public static BackoffPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Delay to wait after the given zero-based attempt failed.
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        double nanos = Math.min(
                baseDelay.toNanos() * Math.pow(multiplier, attempt),
                (double) maxDelay.toNanos());

        if (jitterEnabled) {
            Random source = random != null ? random : ThreadLocalRandom.current();
            double jitter = nanos * JITTER_FRACTION;
            nanos += (source.nextDouble() * 2.0 - 1.0) * jitter;
        }

        return Duration.ofNanos(Math.max(Math.round(nanos), MIN_DELAY.toNanos()));
    }

    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getMultiplier() { return multiplier; }
    public boolean isJitterEnabled() { return jitterEnabled; }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private boolean jitterEnabled = true;
        private Random random;

        public Builder baseDelay(Duration baseDelay) {
            Objects.requireNonNull(baseDelay, "baseDelay");
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("baseDelay must be > 0");
            }
            this.baseDelay = baseDelay;
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

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitterEnabled(boolean jitterEnabled) {
            this.jitterEnabled = jitterEnabled;
            return this;
        }

        /**
         * Fixed random source for reproducible jitter. Defaults to {@link ThreadLocalRandom}.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public BackoffPolicy build() {
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("baseDelay cannot exceed maxDelay");
            }
            return new BackoffPolicy(this);
        }
    }

    @Override
    public String toString() {
        return "BackoffPolicy{" +
                "baseDelay=" + baseDelay +
                ", maxDelay=" + maxDelay +
                ", multiplier=" + multiplier +
                ", jitterEnabled=" + jitterEnabled +
                '}';
    }
}
