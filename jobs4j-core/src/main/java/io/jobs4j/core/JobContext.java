package io.jobs4j.core;

import org.slf4j.Logger;

import java.time.Instant;

/**
 * Per-attempt view handed to a handler. Not persisted.
 *
 * @param jobId         job kind being executed
 * @param attemptNumber 1-based attempt number
 * @param scheduledAt   when the scheduler started this attempt
 * @param data          payload converted to the definition's payload type
 * @param logger        logger scoped to the job kind
 */
public record JobContext<T>(
        String jobId,
        int attemptNumber,
        Instant scheduledAt,
        T data,
        Logger logger
) {
}
