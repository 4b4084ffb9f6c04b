package io.jobs4j.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void exponentialShouldDoubleUntilCapped() {
        RetryPolicy policy = RetryPolicy.exponential(10, Duration.ofSeconds(1), Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(2), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(8), policy.delayFor(4));
        assertEquals(Duration.ofSeconds(16), policy.delayFor(5));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(6));
    }

    @Test
    void exponentialShouldNotOverflowForLargeAttempts() {
        RetryPolicy policy = RetryPolicy.exponential(1000, Duration.ofMillis(250), Duration.ofMinutes(5));

        assertEquals(Duration.ofMinutes(5), policy.delayFor(63));
        assertEquals(Duration.ofMinutes(5), policy.delayFor(500));
    }

    @Test
    void linearShouldGrowByInitialDelay() {
        RetryPolicy policy = RetryPolicy.linear(5, Duration.ofSeconds(2), Duration.ofSeconds(7));

        assertEquals(Duration.ofSeconds(2), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(6), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(7), policy.delayFor(4));
    }

    @Test
    void fixedShouldAlwaysReturnInitialDelay() {
        RetryPolicy policy = RetryPolicy.fixed(4, Duration.ofMillis(500));

        assertEquals(Duration.ofMillis(500), policy.delayFor(1));
        assertEquals(Duration.ofMillis(500), policy.delayFor(3));
    }

    @Test
    void delaysShouldNeverDecrease() {
        RetryPolicy policy = RetryPolicy.exponential(20, Duration.ofMillis(100), Duration.ofSeconds(10));

        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 20; attempt++) {
            Duration delay = policy.delayFor(attempt);
            assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempt);
            previous = delay;
        }
    }

    @Test
    void defaultsShouldMatchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(3, policy.maxAttempts());
        assertEquals(BackoffStrategy.EXPONENTIAL, policy.backoffStrategy());
        assertEquals(Duration.ofSeconds(1), policy.initialDelay());
        assertEquals(Duration.ofSeconds(30), policy.maxDelay());
        assertEquals(0.0d, policy.jitter());
    }

    @Test
    void constructorShouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.exponential(0, Duration.ofSeconds(1), Duration.ofSeconds(30)));
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.exponential(3, Duration.ZERO, Duration.ofSeconds(30)));
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.exponential(3, Duration.ofSeconds(5), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.defaults().withJitter(1.0d));
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.defaults().withJitter(-0.1d));
    }
}
