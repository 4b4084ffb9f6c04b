package io.jobs4j;

import io.jobs4j.core.QueuedJob;

/**
 * Durable record of jobs that exhausted their retry budget.
 *
 * <p>The worker logs and ignores any exception thrown here.
 */
@FunctionalInterface
public interface DeadLetterSink {

    void record(QueuedJob job, String finalError);
}
