package io.jobs4j.internal.mongo;

import io.jobs4j.core.Priority;
import io.jobs4j.core.QueuedJob;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for jobs waiting in, or leased from, the queue.
 *
 * <p>{@code priority} is stored as {@link Priority#value()} so the claim query can sort on it.
 * The lock fields are set while a worker holds the lease and cleared on requeue.
 */
@Document(collection = "queued_jobs")
public class QueuedJobDocument {

    @Id
    private String id;

    private String jobId;
    private Object data;
    private int priority;
    private long sequence;
    private int attemptNumber;
    private int maxAttempts;
    private Instant enqueuedAt;
    private Instant notBeforeAt;
    private String lastError;

    private Instant lockedAt;
    private Instant lockUntil;
    private String lockedBy;

    public QueuedJobDocument() {
    }

    static QueuedJobDocument from(QueuedJob job) {
        QueuedJobDocument doc = new QueuedJobDocument();
        doc.setId(job.getId());
        doc.setJobId(job.getJobId());
        doc.setData(job.getData());
        doc.setPriority(job.getPriority().value());
        doc.setSequence(job.getSequence());
        doc.setAttemptNumber(job.getAttemptNumber());
        doc.setMaxAttempts(job.getMaxAttempts());
        doc.setEnqueuedAt(job.getEnqueuedAt());
        doc.setNotBeforeAt(job.getNotBeforeAt());
        doc.setLastError(job.getLastError());
        return doc;
    }

    QueuedJob toQueuedJob() {
        return new QueuedJob(
                id,
                jobId,
                data,
                Priority.fromValue(priority),
                attemptNumber,
                maxAttempts,
                enqueuedAt,
                notBeforeAt,
                lastError,
                sequence
        );
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public Object getData() {
        return data;
    }

    public void setData(Object data) {
        this.data = data;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public void setAttemptNumber(int attemptNumber) {
        this.attemptNumber = attemptNumber;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void setEnqueuedAt(Instant enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
    }

    public Instant getNotBeforeAt() {
        return notBeforeAt;
    }

    public void setNotBeforeAt(Instant notBeforeAt) {
        this.notBeforeAt = notBeforeAt;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public Instant getLockUntil() {
        return lockUntil;
    }

    public void setLockUntil(Instant lockUntil) {
        this.lockUntil = lockUntil;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }
}
