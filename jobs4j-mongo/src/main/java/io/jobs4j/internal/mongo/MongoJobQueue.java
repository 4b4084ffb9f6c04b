package io.jobs4j.internal.mongo;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.jobs4j.JobQueue;
import io.jobs4j.core.QueueUnavailableException;
import io.jobs4j.core.QueuedJob;
import io.jobs4j.core.QueuedJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable, lease-based {@link JobQueue} on MongoDB.
 *
 * <p>A job is claimable when:
 * <ul>
 *   <li>{@code notBeforeAt <= now}</li>
 *   <li>and it is not leased, or its lease has expired: {@code lockUntil == null || lockUntil <= now}</li>
 * </ul>
 * Claims are single-document {@code findAndModify} calls, so concurrent workers in any number of
 * processes never hold the same job. A worker that dies holding a lease does not lose the job:
 * it becomes claimable again once {@code lockUntil} passes, with its attempt number unchanged.
 *
 * <p>Requeue, acknowledge and {@link #extendLease} only apply while this worker still holds the
 * lease, which prevents a stale write-back after another worker re-claimed an expired lease.
 */
public class MongoJobQueue implements JobQueue {

    static final String SEQUENCE_ID = "queued_jobs";

    private static final Sort DISPATCH_ORDER = Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("sequence"));

    private final MongoTemplate mongoTemplate;
    private final Duration leaseLifetime;
    private final String workerId;
    private final Clock clock;
    private final Logger log;

    public MongoJobQueue(MongoTemplate mongoTemplate, Duration leaseLifetime, String workerId) {
        this(mongoTemplate, leaseLifetime, workerId, Clock.systemUTC(), LoggerFactory.getLogger(MongoJobQueue.class));
    }

    public MongoJobQueue(MongoTemplate mongoTemplate,
                         Duration leaseLifetime,
                         String workerId,
                         Clock clock,
                         Logger log) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.leaseLifetime = Objects.requireNonNull(leaseLifetime, "leaseLifetime must not be null");
        if (leaseLifetime.isZero() || leaseLifetime.isNegative()) {
            throw new IllegalArgumentException("leaseLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        this.workerId = workerId;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    @Override
    public void enqueue(QueuedJob job) {
        Objects.requireNonNull(job, "job must not be null");
        withStore("enqueue", () -> {
            job.setSequence(nextSequence());
            try {
                mongoTemplate.insert(QueuedJobDocument.from(job));
            } catch (DuplicateKeyException e) {
                throw new IllegalStateException("Job instance already queued: " + job.getId(), e);
            }
            log.debug("Enqueued job jobId={} id={} priority={} notBeforeAt={} sequence={}",
                    job.getJobId(), job.getId(), job.getPriority(), job.getNotBeforeAt(), job.getSequence());
            return null;
        });
    }

    @Override
    public Optional<QueuedJob> dequeue() {
        return withStore("dequeue", () -> {
            Instant now = clock.instant();
            Instant lockUntil = now.plus(leaseLifetime);

            Query claimQuery = new Query(Criteria.where("notBeforeAt").lte(now).orOperator(notLeased(now)))
                    .with(DISPATCH_ORDER);

            Update lockUpdate = new Update()
                    .set("lockedAt", now)
                    .set("lockUntil", lockUntil)
                    .set("lockedBy", workerId);

            QueuedJobDocument doc = mongoTemplate.findAndModify(
                    claimQuery,
                    lockUpdate,
                    FindAndModifyOptions.options().returnNew(true),
                    QueuedJobDocument.class
            );
            if (doc == null) {
                return Optional.empty();
            }
            log.debug("Claimed job jobId={} id={} attempt={}/{} lockUntil={} workerId={}",
                    doc.getJobId(), doc.getId(), doc.getAttemptNumber(), doc.getMaxAttempts(), lockUntil, workerId);
            return Optional.of(doc.toQueuedJob());
        });
    }

    @Override
    public Optional<QueuedJob> peek() {
        return withStore("peek", () -> {
            Instant now = clock.instant();
            Query q = new Query(Criteria.where("notBeforeAt").lte(now).orOperator(notLeased(now)))
                    .with(DISPATCH_ORDER);
            return Optional.ofNullable(mongoTemplate.findOne(q, QueuedJobDocument.class))
                    .map(QueuedJobDocument::toQueuedJob);
        });
    }

    /**
     * Pushes {@code lockUntil} to now plus the lease lifetime.
     */
    @Override
    public boolean extendLease(QueuedJob job) {
        Objects.requireNonNull(job, "job must not be null");
        return withStore("extendLease", () -> {
            Instant lockUntil = clock.instant().plus(leaseLifetime);
            UpdateResult r = mongoTemplate.updateFirst(
                    leasedBySelf(job.getId()), new Update().set("lockUntil", lockUntil), QueuedJobDocument.class);
            if (r.getMatchedCount() == 0) {
                log.warn("Lease lost while running jobId={} id={} workerId={}", job.getJobId(), job.getId(), workerId);
                return false;
            }
            log.debug("Extended lease jobId={} id={} lockUntil={}", job.getJobId(), job.getId(), lockUntil);
            return true;
        });
    }

    @Override
    public void requeue(QueuedJob job) {
        Objects.requireNonNull(job, "job must not be null");
        withStore("requeue", () -> {
            Update u = new Update()
                    .set("attemptNumber", job.getAttemptNumber())
                    .set("notBeforeAt", job.getNotBeforeAt())
                    .unset("lockedAt")
                    .unset("lockUntil")
                    .unset("lockedBy");
            if (job.getLastError() != null) {
                u.set("lastError", job.getLastError());
            }

            UpdateResult r = mongoTemplate.updateFirst(leasedBySelf(job.getId()), u, QueuedJobDocument.class);
            if (r.getMatchedCount() == 0) {
                log.warn("Lease lost before requeue jobId={} id={} workerId={}", job.getJobId(), job.getId(), workerId);
            }
            return null;
        });
    }

    @Override
    public void acknowledge(QueuedJob job) {
        Objects.requireNonNull(job, "job must not be null");
        withStore("acknowledge", () -> {
            DeleteResult r = mongoTemplate.remove(leasedBySelf(job.getId()), QueuedJobDocument.class);
            if (r.getDeletedCount() == 0) {
                log.warn("Lease lost before acknowledge jobId={} id={} workerId={}", job.getJobId(), job.getId(), workerId);
            }
            return null;
        });
    }

    /**
     * Removes a job that is not currently leased.
     */
    @Override
    public boolean remove(String queuedJobId) {
        Objects.requireNonNull(queuedJobId, "queuedJobId must not be null");
        return withStore("remove", () -> {
            Query q = new Query(Criteria.where("_id").is(queuedJobId).orOperator(notLeased(clock.instant())));
            boolean removed = mongoTemplate.remove(q, QueuedJobDocument.class).getDeletedCount() > 0;
            if (removed) {
                log.debug("Removed job id={}", queuedJobId);
            }
            return removed;
        });
    }

    /**
     * Removes every job whose lease is absent or expired.
     */
    @Override
    public long clear() {
        return withStore("clear", () -> {
            long removed = mongoTemplate.remove(new Query(new Criteria().orOperator(notLeased(clock.instant()))),
                    QueuedJobDocument.class).getDeletedCount();
            log.info("Cleared job queue removed={}", removed);
            return removed;
        });
    }

    @Override
    public List<QueuedJob> getQueuedJobs() {
        return withStore("list", () -> {
            Query q = new Query(new Criteria().orOperator(notLeased(clock.instant()))).with(DISPATCH_ORDER);
            return mongoTemplate.find(q, QueuedJobDocument.class).stream()
                    .map(QueuedJobDocument::toQueuedJob)
                    .toList();
        });
    }

    /**
     * A job whose lease expired reports {@link QueuedJobStatus#QUEUED}: any worker may claim it.
     */
    @Override
    public QueuedJobStatus getJobStatus(String queuedJobId) {
        Objects.requireNonNull(queuedJobId, "queuedJobId must not be null");
        return withStore("status", () -> {
            QueuedJobDocument doc = mongoTemplate.findById(queuedJobId, QueuedJobDocument.class);
            if (doc == null) {
                return QueuedJobStatus.NOT_FOUND;
            }
            Instant lockUntil = doc.getLockUntil();
            return lockUntil != null && lockUntil.isAfter(clock.instant())
                    ? QueuedJobStatus.LEASED
                    : QueuedJobStatus.QUEUED;
        });
    }

    @Override
    public long getQueueSize() {
        return withStore("count", () -> mongoTemplate.count(new Query(), QueuedJobDocument.class));
    }

    public String getWorkerId() {
        return workerId;
    }

    private long nextSequence() {
        JobSequenceDocument counter = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(SEQUENCE_ID)),
                new Update().inc("value", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                JobSequenceDocument.class
        );
        if (counter == null) {
            throw new IllegalStateException("Sequence counter upsert returned no document");
        }
        return counter.getValue();
    }

    private static Criteria[] notLeased(Instant now) {
        return new Criteria[]{
                Criteria.where("lockUntil").is(null),
                Criteria.where("lockUntil").lte(now)
        };
    }

    private Query leasedBySelf(String id) {
        return new Query(
                Criteria.where("_id").is(id)
                        .and("lockedBy").is(workerId)
        );
    }

    private <R> R withStore(String operation, Supplier<R> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Mongo job queue " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
