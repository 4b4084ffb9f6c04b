package io.jobs4j.core;

/**
 * How the delay between two attempts grows with the attempt number.
 *
 * <p>Every strategy returns the raw, unclamped multiple of the initial delay;
 * {@link RetryPolicy#delayFor(int)} applies the {@code [initialDelay, maxDelay]} bounds.
 */
public enum BackoffStrategy {
    FIXED {
        @Override
        public long multiplier(int attemptNumber) {
            return 1L;
        }
    },
    LINEAR {
        @Override
        public long multiplier(int attemptNumber) {
            return Math.max(1, attemptNumber);
        }
    },
    EXPONENTIAL {
        @Override
        public long multiplier(int attemptNumber) {
            int exp = Math.max(0, attemptNumber - 1);
            // 2^62 already exceeds any sane maxDelay in millis
            return exp >= 62 ? Long.MAX_VALUE : 1L << exp;
        }
    };

    /**
     * @param attemptNumber the attempt that just failed (1-based)
     * @return factor applied to the initial delay, saturating at {@link Long#MAX_VALUE}
     */
    public abstract long multiplier(int attemptNumber);
}
