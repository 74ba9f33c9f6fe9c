package com.jonathantong.WalShift.consumer;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnect schedule for a change stream consumer.
 * <p>
 * The delay before attempt n is {@code interval * multiplier^(n-1)}, capped at
 * {@code maxInterval}. A multiplier of 1.0 gives a fixed delay; {@code maxAttempts}
 * of 0 retries forever.
 */
public class RetryPolicy {

    private final Duration interval;
    private final double multiplier;
    private final Duration maxInterval;
    private final int maxAttempts;

    public RetryPolicy(Duration interval, double multiplier, Duration maxInterval, int maxAttempts) {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.maxInterval = Objects.requireNonNull(maxInterval, "maxInterval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative: " + interval);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        }
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    public static RetryPolicy fixed(Duration interval) {
        return new RetryPolicy(interval, 1.0, interval, 0);
    }

    /**
     * @param attempt 1 for the first retry after a failure
     */
    public boolean canRetry(int attempt) {
        return maxAttempts == 0 || attempt <= maxAttempts;
    }

    /**
     * @param attempt 1 for the first retry after a failure
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt starts at 1: " + attempt);
        }
        if (multiplier == 1.0) {
            return interval;
        }
        double millis = interval.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= maxInterval.toMillis()) {
            return maxInterval;
        }
        return Duration.ofMillis((long) millis);
    }

    public Duration getInterval() { return interval; }

    public double getMultiplier() { return multiplier; }

    public Duration getMaxInterval() { return maxInterval; }

    public int getMaxAttempts() { return maxAttempts; }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "interval=" + interval +
                ", multiplier=" + multiplier +
                ", maxInterval=" + maxInterval +
                ", maxAttempts=" + (maxAttempts == 0 ? "unbounded" : maxAttempts) +
                '}';
    }
}
