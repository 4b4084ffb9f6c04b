package io.jobs4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry budget and backoff shape of a job kind.
 *
 * @param maxAttempts     total number of attempts including the first one, at least 1
 * @param backoffStrategy growth of the delay between attempts
 * @param initialDelay    delay after the first failure, at least one millisecond
 * @param maxDelay        upper bound of any delay, not below {@code initialDelay}
 * @param jitter          random spread applied around the computed delay, in {@code [0, 1)}
 */
public record RetryPolicy(
        int maxAttempts,
        BackoffStrategy backoffStrategy,
        Duration initialDelay,
        Duration maxDelay,
        double jitter
) {

    public RetryPolicy {
        Objects.requireNonNull(backoffStrategy, "backoffStrategy must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (initialDelay.toMillis() < 1) {
            throw new IllegalArgumentException("initialDelay must be at least 1ms, got: " + initialDelay);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
        }
    }

    public RetryPolicy(int maxAttempts, BackoffStrategy backoffStrategy, Duration initialDelay, Duration maxDelay) {
        this(maxAttempts, backoffStrategy, initialDelay, maxDelay, 0.0d);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, BackoffStrategy.EXPONENTIAL, initialDelay, maxDelay);
    }

    public static RetryPolicy linear(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, BackoffStrategy.LINEAR, initialDelay, maxDelay);
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, BackoffStrategy.FIXED, delay, delay);
    }

    /**
     * Three attempts, exponential from 1s capped at 30s.
     */
    public static RetryPolicy defaults() {
        return exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    public RetryPolicy withJitter(double jitter) {
        return new RetryPolicy(maxAttempts, backoffStrategy, initialDelay, maxDelay, jitter);
    }

    /**
     * Deterministic delay before the attempt following {@code attemptNumber}.
     *
     * @param attemptNumber the attempt that just failed (1-based)
     * @return delay clamped to {@code [initialDelay, maxDelay]}
     */
    public Duration delayFor(int attemptNumber) {
        long initialMs = initialDelay.toMillis();
        long maxMs = maxDelay.toMillis();
        long multiplier = backoffStrategy.multiplier(attemptNumber);

        long delayMs = multiplier > maxMs / Math.max(1L, initialMs)
                ? maxMs
                : initialMs * multiplier;
        return Duration.ofMillis(clamp(delayMs));
    }

    long clamp(long delayMs) {
        return Math.max(initialDelay.toMillis(), Math.min(maxDelay.toMillis(), delayMs));
    }
}
