package io.jobs4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.core.InvalidPayloadException;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobDefinitionRegistry;
import io.jobs4j.core.PayloadCodec;
import io.jobs4j.core.Priority;
import io.jobs4j.core.QueuedJob;
import io.jobs4j.core.UnknownJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Entry point for producers: webhooks, UI actions and cron triggers call this to add work.
 *
 * <p>The payload is checked against the definition before anything reaches the queue: it is
 * converted to the definition's payload type, passed to its validator, and stored as plain
 * values. {@code maxAttempts} and the default priority are copied from the definition.
 *
 * <p>Typical usage:
 * <pre>{@code
 * enqueuer.enqueue("send-notifications", Map.of("userId", "u-1"));
 *
 * enqueuer.create("process-campaign-data", payload)
 *         .priority(Priority.HIGH)
 *         .delay(Duration.ofMinutes(5))
 *         .enqueue();
 * }</pre>
 */
public class JobEnqueuer {

    private final JobDefinitionRegistry registry;
    private final JobQueue queue;
    private final PayloadCodec payloadCodec;
    private final Clock clock;
    private final Logger log;

    public JobEnqueuer(JobScheduler scheduler, JobQueue queue, ObjectMapper objectMapper) {
        this(scheduler.getRegistry(), queue, objectMapper, Clock.systemUTC(), LoggerFactory.getLogger(JobEnqueuer.class));
    }

    public JobEnqueuer(JobDefinitionRegistry registry, JobQueue queue, ObjectMapper objectMapper, Clock clock, Logger log) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.payloadCodec = new PayloadCodec(Objects.requireNonNull(objectMapper, "objectMapper must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    /**
     * Enqueue with the definition's priority, ready immediately.
     */
    public QueuedJob enqueue(String jobId, Object data) {
        return create(jobId, data).enqueue();
    }

    /**
     * @param priority  null means the definition's priority
     * @param notBefore null means ready immediately
     * @throws UnknownJobException     if no definition is registered for {@code jobId}
     * @throws InvalidPayloadException if the payload does not fit the definition
     */
    public QueuedJob enqueue(String jobId, Object data, Priority priority, Instant notBefore) {
        return create(jobId, data).priority(priority).notBefore(notBefore).enqueue();
    }

    /**
     * Start a request; nothing is queued until {@link EnqueueRequest#enqueue()}.
     */
    public EnqueueRequest create(String jobId, Object data) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return new EnqueueRequest(jobId, data);
    }

    private QueuedJob submit(EnqueueRequest request) {
        JobDefinition<?> definition = registry.getRequired(request.jobId).definition();
        Object stored = normalize(definition, request.data);

        Instant now = clock.instant();
        Instant notBefore = request.notBefore;
        if (notBefore == null && request.delay != null) {
            notBefore = now.plus(request.delay);
        }
        Priority priority = request.priority != null ? request.priority : definition.priority();

        QueuedJob job = QueuedJob.newJob(
                definition.id(),
                stored,
                priority,
                definition.retryPolicy().maxAttempts(),
                now,
                notBefore != null ? notBefore : now
        );
        queue.enqueue(job);

        log.info("Enqueued job jobId={} id={} priority={} notBeforeAt={}",
                job.getJobId(), job.getId(), job.getPriority(), job.getNotBeforeAt());
        return job;
    }

    private <T> Object normalize(JobDefinition<T> definition, Object data) {
        Class<T> type = definition.payloadType();
        T typed = type.isInstance(data)
                ? type.cast(data)
                : payloadCodec.fromStored(payloadCodec.toStored(data), type);
        definition.payloadValidator().validate(typed);
        return payloadCodec.toStored(typed);
    }

    /**
     * Fluent options for one enqueue call.
     */
    public final class EnqueueRequest {
        private final String jobId;
        private final Object data;
        private Priority priority;
        private Instant notBefore;
        private Duration delay;

        private EnqueueRequest(String jobId, Object data) {
            this.jobId = jobId;
            this.data = data;
        }

        /**
         * Override the definition's priority for this instance only.
         */
        public EnqueueRequest priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Earliest dequeue time. Takes precedence over {@link #delay(Duration)}.
         */
        public EnqueueRequest notBefore(Instant notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public EnqueueRequest delay(Duration delay) {
            if (delay != null && delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
            this.delay = delay;
            return this;
        }

        public QueuedJob enqueue() {
            return submit(this);
        }
    }
}
