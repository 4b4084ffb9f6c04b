package io.jobs4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes when a failed job becomes eligible again.
 *
 * <p>The base delay comes from {@link RetryPolicy#delayFor(int)}. When the policy declares a
 * jitter fraction {@code j}, the delay is scaled by a random factor in {@code [1 - j, 1 + j)} and
 * clamped back into {@code [initialDelay, maxDelay]}, so jobs failing together spread out.
 */
public final class Backoff {

    private final DoubleSupplier random;

    public Backoff() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in {@code [0, 1)}
     */
    public Backoff(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public Duration nextDelay(RetryPolicy policy, int attemptNumber) {
        Objects.requireNonNull(policy, "policy must not be null");
        Duration base = policy.delayFor(attemptNumber);
        if (policy.jitter() == 0.0d) {
            return base;
        }
        double factor = 1.0d + policy.jitter() * (2.0d * random.getAsDouble() - 1.0d);
        long jittered = (long) (base.toMillis() * factor);
        return Duration.ofMillis(policy.clamp(jittered));
    }

    public Instant nextAttemptAt(RetryPolicy policy, int attemptNumber, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return now.plus(nextDelay(policy, attemptNumber));
    }
}
