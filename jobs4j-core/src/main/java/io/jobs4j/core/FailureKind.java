package io.jobs4j.core;

/**
 * Why an execution attempt produced a failed {@link JobResult}.
 * Stored under {@link JobResult#FAILURE_KEY} in the result metadata.
 */
public enum FailureKind {
    /** The handler returned a result with {@code success == false}. */
    HANDLER_FAILURE,
    /** The handler threw, or returned no result at all. */
    HANDLER_FAULT,
    TIMEOUT,
    UNKNOWN_JOB,
    INVALID_PAYLOAD
}
