package io.jobs4j.config;

import io.jobs4j.internal.mongo.DeadJobDocument;
import io.jobs4j.internal.mongo.QueuedJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the job queue.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code jobs.ensure-indexes-on-startup=true}. In production they usually come from migrations
 * or ops scripts.
 *
 * <h3>Collection {@code queued_jobs}</h3>
 * <ul>
 *   <li><b>idx_claim</b>: { notBeforeAt: 1, lockUntil: 1 }
 *       <br/>Filters ready, unleased jobs when claiming.</li>
 *   <li><b>idx_dispatch_order</b>: { priority: -1, sequence: 1 }
 *       <br/>Claim sort order.</li>
 * </ul>
 *
 * <h3>Collection {@code dead_jobs}</h3>
 * <ul>
 *   <li><b>idx_dead_job_failed</b>: { jobId: 1, failedAt: -1 }
 *       <br/>Operator lookups by job kind, newest first.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.queued_jobs.createIndex({ notBeforeAt: 1, lockUntil: 1 }, { name: "idx_claim" });
 * db.queued_jobs.createIndex({ priority: -1, sequence: 1 }, { name: "idx_dispatch_order" });
 * db.dead_jobs.createIndex({ jobId: 1, failedAt: -1 }, { name: "idx_dead_job_failed" });
 * </pre>
 */
public class JobsMongoIndexConfig {

    public static final String IDX_CLAIM = "idx_claim";
    public static final String IDX_DISPATCH_ORDER = "idx_dispatch_order";
    public static final String IDX_DEAD_JOB_FAILED = "idx_dead_job_failed";

    private final MongoTemplate mongoTemplate;

    public JobsMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the indexes listed above. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(QueuedJobDocument.class).createIndex(claimIndex());
        mongoTemplate.indexOps(QueuedJobDocument.class).createIndex(dispatchOrderIndex());
        mongoTemplate.indexOps(DeadJobDocument.class).createIndex(deadJobFailedIndex());
    }

    public static Index claimIndex() {
        return new Index()
                .on("notBeforeAt", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_CLAIM);
    }

    public static Index dispatchOrderIndex() {
        return new Index()
                .on("priority", Sort.Direction.DESC)
                .on("sequence", Sort.Direction.ASC)
                .named(IDX_DISPATCH_ORDER);
    }

    public static Index deadJobFailedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("failedAt", Sort.Direction.DESC)
                .named(IDX_DEAD_JOB_FAILED);
    }
}
