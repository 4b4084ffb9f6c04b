package io.jobs4j;

import io.jobs4j.core.QueuedJob;
import io.jobs4j.core.QueuedJobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Ordered holding area for pending and retry-scheduled jobs.
 *
 * <p>Ordering among ready jobs ({@code notBeforeAt <= now}): priority descending, then
 * enqueue order. Jobs that are not ready are invisible to {@link #dequeue()}.
 *
 * <p>All operations are atomic with respect to each other. A dequeued job is leased to the
 * caller until it is {@link #acknowledge acknowledged} or {@link #requeue requeued}; no other
 * caller can dequeue it meanwhile.
 *
 * <p>Implementations signal an unreachable backing store with
 * {@link io.jobs4j.core.QueueUnavailableException}.
 */
public interface JobQueue {

    /**
     * Adds a job and assigns its sequence number.
     */
    void enqueue(QueuedJob job);

    /**
     * Takes the best ready job and leases it to the caller.
     *
     * @return the job, or empty when no job is ready
     */
    Optional<QueuedJob> dequeue();

    /**
     * The job {@link #dequeue()} would take next, without leasing it.
     */
    Optional<QueuedJob> peek();

    /**
     * Keeps a leased job away from other workers while its handler is still running.
     *
     * @return false if the caller no longer holds the lease
     */
    boolean extendLease(QueuedJob job);

    /**
     * Returns a leased job whose attempt failed. The caller has already advanced
     * {@code attemptNumber} and {@code notBeforeAt}; priority and sequence are kept.
     */
    void requeue(QueuedJob job);

    /**
     * Ends the lease of a job that will not run again and forgets it.
     */
    void acknowledge(QueuedJob job);

    /**
     * Cancels a pending job.
     *
     * @return true if a pending job with that instance id was removed
     */
    boolean remove(String queuedJobId);

    /**
     * Removes every job that is not leased. Leased jobs finish normally.
     *
     * @return number of jobs removed
     */
    long clear();

    /**
     * Snapshot of the jobs not leased, ready or not, in dispatch order.
     */
    List<QueuedJob> getQueuedJobs();

    QueuedJobStatus getJobStatus(String queuedJobId);

    /**
     * Approximate number of jobs not yet completed, leased ones included.
     */
    long getQueueSize();
}
