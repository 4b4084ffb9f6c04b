package io.jobs4j.core;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A concrete job instance waiting in, or leased from, a {@code JobQueue}.
 *
 * <p>Only the worker mutates an instance, through {@link #scheduleRetry(String, Instant)} and
 * {@link #markFailed(String)}. {@code attemptNumber} never decreases and never exceeds
 * {@code maxAttempts}.
 */
public class QueuedJob {

    private final String id;
    private final String jobId;
    private final Object data;
    private final Priority priority;
    private final int maxAttempts;
    private final Instant enqueuedAt;

    private int attemptNumber;
    private Instant notBeforeAt;
    private String lastError;
    private long sequence;

    public QueuedJob(String id,
                     String jobId,
                     Object data,
                     Priority priority,
                     int attemptNumber,
                     int maxAttempts,
                     Instant enqueuedAt,
                     Instant notBeforeAt,
                     String lastError,
                     long sequence) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "enqueuedAt must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (attemptNumber < 1 || attemptNumber > maxAttempts) {
            throw new IllegalArgumentException("attemptNumber must be in [1, " + maxAttempts + "], got: " + attemptNumber);
        }
        this.data = data;
        this.attemptNumber = attemptNumber;
        this.maxAttempts = maxAttempts;
        this.notBeforeAt = notBeforeAt != null ? notBeforeAt : enqueuedAt;
        this.lastError = lastError;
        this.sequence = sequence;
    }

    /**
     * A fresh instance on its first attempt.
     */
    public static QueuedJob newJob(String jobId,
                                   Object data,
                                   Priority priority,
                                   int maxAttempts,
                                   Instant enqueuedAt,
                                   Instant notBeforeAt) {
        return new QueuedJob(
                UUID.randomUUID().toString(),
                jobId,
                data,
                priority,
                1,
                maxAttempts,
                enqueuedAt,
                notBeforeAt,
                null,
                0L
        );
    }

    public boolean isReady(Instant now) {
        return !notBeforeAt.isAfter(now);
    }

    /**
     * True when the current attempt is the last one the retry budget allows.
     */
    public boolean isLastAttempt() {
        return attemptNumber >= maxAttempts;
    }

    /**
     * Records a failed attempt and moves to the next one.
     *
     * @throws IllegalStateException if the retry budget is already spent
     */
    public void scheduleRetry(String error, Instant nextNotBeforeAt) {
        Objects.requireNonNull(nextNotBeforeAt, "nextNotBeforeAt must not be null");
        if (isLastAttempt()) {
            throw new IllegalStateException("Job " + id + " has no attempts left (" + attemptNumber + "/" + maxAttempts + ")");
        }
        this.lastError = error;
        this.attemptNumber++;
        this.notBeforeAt = nextNotBeforeAt;
    }

    /**
     * Records the final failed attempt without moving on.
     */
    public void markFailed(String error) {
        this.lastError = error;
    }

    public String getId() {
        return id;
    }

    public String getJobId() {
        return jobId;
    }

    public Object getData() {
        return data;
    }

    public Priority getPriority() {
        return priority;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public Instant getNotBeforeAt() {
        return notBeforeAt;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Queue-assigned FIFO position among jobs of equal priority; 0 until enqueued.
     */
    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    @Override
    public String toString() {
        return "QueuedJob{id=" + id
                + ", jobId=" + jobId
                + ", priority=" + priority
                + ", attempt=" + attemptNumber + "/" + maxAttempts
                + ", notBeforeAt=" + notBeforeAt
                + ", sequence=" + sequence
                + '}';
    }
}
