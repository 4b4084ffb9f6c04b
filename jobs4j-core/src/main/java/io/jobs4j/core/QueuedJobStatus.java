package io.jobs4j.core;

/**
 * Where a job instance currently sits in a {@link io.jobs4j.JobQueue}.
 */
public enum QueuedJobStatus {
    /** Waiting to be dequeued, possibly not ready yet. */
    QUEUED,
    /** Dequeued and held by a worker. */
    LEASED,
    /** Never enqueued, or already acknowledged or removed. */
    NOT_FOUND
}
