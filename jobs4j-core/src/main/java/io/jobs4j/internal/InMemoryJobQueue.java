package io.jobs4j.internal;

import io.jobs4j.JobQueue;
import io.jobs4j.core.QueuedJob;
import io.jobs4j.core.QueuedJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-protected, process-local {@link JobQueue}.
 *
 * <p>Ready jobs sit in a set ordered by priority then sequence; jobs waiting for their
 * {@code notBeforeAt} sit in a second heap ordered by that instant and are promoted on
 * {@link #dequeue()}. Nothing survives a restart: use the Mongo queue where durability matters.
 */
public class InMemoryJobQueue implements JobQueue {

    static final Comparator<QueuedJob> DISPATCH_ORDER = Comparator
            .comparingInt((QueuedJob j) -> j.getPriority().value()).reversed()
            .thenComparingLong(QueuedJob::getSequence);

    static final Comparator<QueuedJob> READINESS_ORDER = Comparator
            .comparing(QueuedJob::getNotBeforeAt)
            .thenComparingLong(QueuedJob::getSequence);

    private final ReentrantLock lock = new ReentrantLock();
    private final TreeSet<QueuedJob> ready = new TreeSet<>(DISPATCH_ORDER);
    private final PriorityQueue<QueuedJob> delayed = new PriorityQueue<>(READINESS_ORDER);
    private final Map<String, QueuedJob> pendingById = new HashMap<>();
    private final Map<String, QueuedJob> leasedById = new HashMap<>();
    private final Clock clock;
    private final Logger log;
    private long sequence;

    public InMemoryJobQueue() {
        this(Clock.systemUTC());
    }

    public InMemoryJobQueue(Clock clock) {
        this(clock, LoggerFactory.getLogger(InMemoryJobQueue.class));
    }

    public InMemoryJobQueue(Clock clock, Logger log) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    @Override
    public void enqueue(QueuedJob job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            ensureNotTracked(job);
            job.setSequence(++sequence);
            place(job);
            log.debug("Enqueued job jobId={} id={} priority={} notBeforeAt={} queueSize={}",
                    job.getJobId(), job.getId(), job.getPriority(), job.getNotBeforeAt(), sizeLocked());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<QueuedJob> dequeue() {
        lock.lock();
        try {
            promoteReady(clock.instant());
            QueuedJob job = ready.pollFirst();
            if (job == null) {
                return Optional.empty();
            }
            pendingById.remove(job.getId());
            leasedById.put(job.getId(), job);
            log.debug("Dequeued job jobId={} id={} remaining={}", job.getJobId(), job.getId(), pendingById.size());
            return Optional.of(job);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<QueuedJob> peek() {
        lock.lock();
        try {
            promoteReady(clock.instant());
            return ready.isEmpty() ? Optional.empty() : Optional.of(ready.first());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Leases here never expire, so this only reports whether the job is still leased.
     */
    @Override
    public boolean extendLease(QueuedJob job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            return leasedById.containsKey(job.getId());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void requeue(QueuedJob job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            leasedById.remove(job.getId());
            ensureNotTracked(job);
            if (job.getSequence() == 0L) {
                job.setSequence(++sequence);
            }
            place(job);
            log.debug("Requeued job jobId={} id={} attempt={}/{} notBeforeAt={}",
                    job.getJobId(), job.getId(), job.getAttemptNumber(), job.getMaxAttempts(), job.getNotBeforeAt());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void acknowledge(QueuedJob job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            leasedById.remove(job.getId());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String queuedJobId) {
        lock.lock();
        try {
            QueuedJob job = pendingById.remove(queuedJobId);
            if (job == null) {
                return false;
            }
            if (!ready.remove(job)) {
                delayed.remove(job);
            }
            log.debug("Removed job jobId={} id={}", job.getJobId(), job.getId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long clear() {
        lock.lock();
        try {
            int removed = pendingById.size();
            pendingById.clear();
            ready.clear();
            delayed.clear();
            log.info("Cleared job queue removed={}", removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueuedJob> getQueuedJobs() {
        lock.lock();
        try {
            List<QueuedJob> jobs = new ArrayList<>(pendingById.values());
            jobs.sort(DISPATCH_ORDER);
            return jobs;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueuedJobStatus getJobStatus(String queuedJobId) {
        lock.lock();
        try {
            if (pendingById.containsKey(queuedJobId)) {
                return QueuedJobStatus.QUEUED;
            }
            return leasedById.containsKey(queuedJobId) ? QueuedJobStatus.LEASED : QueuedJobStatus.NOT_FOUND;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getQueueSize() {
        lock.lock();
        try {
            return sizeLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of jobs currently leased to a worker.
     */
    public int getLeasedCount() {
        lock.lock();
        try {
            return leasedById.size();
        } finally {
            lock.unlock();
        }
    }

    private void place(QueuedJob job) {
        pendingById.put(job.getId(), job);
        if (job.isReady(clock.instant())) {
            ready.add(job);
        } else {
            delayed.add(job);
        }
    }

    private void promoteReady(Instant now) {
        QueuedJob head;
        while ((head = delayed.peek()) != null && head.isReady(now)) {
            delayed.poll();
            ready.add(head);
        }
    }

    private void ensureNotTracked(QueuedJob job) {
        if (pendingById.containsKey(job.getId()) || leasedById.containsKey(job.getId())) {
            throw new IllegalStateException("Job instance already queued: " + job.getId());
        }
    }

    private long sizeLocked() {
        return (long) pendingById.size() + leasedById.size();
    }
}
