package com.github.k8soperators.conductor.model;

import java.time.Duration;
import java.util.Objects;

public final class RetryPolicy {

    public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(30), 2.0);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        this.multiplier = multiplier;
    }

    /**
     * Delay to apply after the given (1-based) failed attempt.
     */
    public Duration backoff(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        double millis = initialBackoff.toMillis() * factor;

        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }

        return Duration.ofMillis((long) millis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{maxAttempts=%d, initialBackoff=%s, maxBackoff=%s, multiplier=%s}",
                maxAttempts, initialBackoff, maxBackoff, multiplier);
    }
}
