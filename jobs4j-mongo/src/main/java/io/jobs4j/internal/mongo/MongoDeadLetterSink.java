package io.jobs4j.internal.mongo;

import io.jobs4j.DeadLetterSink;
import io.jobs4j.JobQueue;
import io.jobs4j.core.Priority;
import io.jobs4j.core.QueueUnavailableException;
import io.jobs4j.core.QueuedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists dead jobs to the {@code dead_jobs} collection and lets operators inspect and replay
 * them.
 */
public class MongoDeadLetterSink implements DeadLetterSink {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final Logger log;

    public MongoDeadLetterSink(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC(), LoggerFactory.getLogger(MongoDeadLetterSink.class));
    }

    public MongoDeadLetterSink(MongoTemplate mongoTemplate, Clock clock, Logger log) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    /**
     * Upserts by queued job id: recording the same instance again replaces the earlier record.
     */
    @Override
    public void record(QueuedJob job, String finalError) {
        DeadJobDocument doc = new DeadJobDocument();
        doc.setId(job.getId());
        doc.setJobId(job.getJobId());
        doc.setData(job.getData());
        doc.setPriority(job.getPriority().value());
        doc.setAttemptNumber(job.getAttemptNumber());
        doc.setMaxAttempts(job.getMaxAttempts());
        doc.setEnqueuedAt(job.getEnqueuedAt());
        doc.setFinalError(finalError);
        doc.setFailedAt(clock.instant());

        try {
            mongoTemplate.save(doc);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Dead-letter insert failed: " + e.getMessage(), e);
        }
        log.warn("Recorded dead job jobId={} id={} attempts={} finalError={}",
                job.getJobId(), job.getId(), job.getAttemptNumber(), finalError);
    }

    /**
     * Most recent dead jobs first.
     *
     * @param jobId null for every job kind
     */
    public List<DeadJobDocument> find(String jobId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = byJobId(jobId);
        q.with(Sort.by(Sort.Order.desc("failedAt")));
        q.limit(limit);
        return mongoTemplate.find(q, DeadJobDocument.class);
    }

    /**
     * @param jobId null for every job kind
     */
    public long count(String jobId) {
        return mongoTemplate.count(byJobId(jobId), DeadJobDocument.class);
    }

    /**
     * Puts a dead job back on {@code queue} as a fresh instance with a full retry budget and
     * deletes the dead record.
     *
     * @return the new queued instance, or empty when no dead job has that id
     */
    public Optional<QueuedJob> replay(String deadJobId, JobQueue queue) {
        Objects.requireNonNull(deadJobId, "deadJobId must not be null");
        Objects.requireNonNull(queue, "queue must not be null");

        DeadJobDocument dead = mongoTemplate.findById(deadJobId, DeadJobDocument.class);
        if (dead == null) {
            return Optional.empty();
        }

        QueuedJob job = QueuedJob.newJob(
                dead.getJobId(),
                dead.getData(),
                Priority.fromValue(dead.getPriority()),
                dead.getMaxAttempts(),
                clock.instant(),
                null
        );
        queue.enqueue(job);
        mongoTemplate.remove(new Query(Criteria.where("_id").is(deadJobId)), DeadJobDocument.class);

        log.info("Replayed dead job jobId={} deadId={} newId={}", dead.getJobId(), deadJobId, job.getId());
        return Optional.of(job);
    }

    private static Query byJobId(String jobId) {
        return jobId == null ? new Query() : new Query(Criteria.where("jobId").is(jobId));
    }
}
