package io.jobs4j;

import io.jobs4j.core.Backoff;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobResult;
import io.jobs4j.core.QueueUnavailableException;
import io.jobs4j.core.QueuedJob;
import io.jobs4j.core.RetryPolicy;
import io.jobs4j.core.WorkerStatus;
import io.jobs4j.internal.LoggingDeadLetterSink;
import io.jobs4j.utils.DaemonThreadFactory;
import io.jobs4j.utils.WorkerIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Polling loop that drains a {@link JobQueue} through a {@link JobScheduler}.
 *
 * <p>Each tick dequeues up to {@code jobsPerTick} jobs and runs them one after another on the
 * worker thread. A failed attempt is requeued with a backoff delay taken from the job's
 * {@link RetryPolicy} until its budget is spent, then the job goes to the {@link DeadLetterSink}.
 * No single job, and no queue outage, can end the loop.
 *
 * <p>{@link #stop()} is cooperative: future ticks are cancelled, the current tick (and the
 * handler it is waiting on) runs to completion, and the caller waits for it up to
 * {@code shutdownTimeout}. Called from a handler, or from the worker thread itself, it returns
 * without waiting.
 *
 * <p>With a {@code leaseRenewalInterval} set, the lease of the running job is extended at that
 * interval until its handler returns, so a queue with expiring leases never hands a long job to
 * a second worker.
 *
 * <p>Create instances via {@link #builder()}.
 */
public class JobWorker implements AutoCloseable {

    private final JobQueue queue;
    private final JobScheduler scheduler;
    private final DeadLetterSink deadLetterSink;
    private final Backoff backoff;
    private final RetryPolicy defaultRetryPolicy;
    private final Clock clock;
    private final Logger log;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;
    private final int jobsPerTick;
    private final String workerId;
    private final Duration leaseRenewalInterval;
    private final ScheduledExecutorService leaseRenewer;

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private volatile Thread tickThread;
    private AtomicBoolean runActive;
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> tickFuture;

    private JobWorker(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue must not be null");
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler must not be null");
        this.deadLetterSink = builder.deadLetterSink != null ? builder.deadLetterSink : new LoggingDeadLetterSink();
        this.backoff = builder.backoff != null ? builder.backoff : new Backoff();
        this.defaultRetryPolicy = builder.defaultRetryPolicy != null ? builder.defaultRetryPolicy : RetryPolicy.defaults();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.log = builder.log != null ? builder.log : LoggerFactory.getLogger(JobWorker.class);
        this.pollInterval = requirePositive(builder.pollInterval, "pollInterval");
        this.shutdownTimeout = Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout must not be null");
        if (builder.jobsPerTick < 1) {
            throw new IllegalArgumentException("jobsPerTick must be >= 1");
        }
        this.jobsPerTick = builder.jobsPerTick;
        this.workerId = WorkerIds.resolve(builder.workerId);
        if (builder.leaseRenewalInterval != null) {
            this.leaseRenewalInterval = requirePositive(builder.leaseRenewalInterval, "leaseRenewalInterval");
            this.leaseRenewer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobs4j-lease-"));
        } else {
            this.leaseRenewalInterval = null;
            this.leaseRenewer = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start polling at the configured interval. No-op when already running.
     */
    public void start() {
        start(pollInterval);
    }

    /**
     * Start polling every {@code interval}. No-op when already running.
     */
    public void start(Duration interval) {
        requirePositive(interval, "interval");
        synchronized (lifecycleLock) {
            if (running) {
                log.warn("Worker is already running workerId={}", workerId);
                return;
            }
            AtomicBoolean active = new AtomicBoolean(true);
            executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobs4j-worker-"));
            tickFuture = executor.scheduleWithFixedDelay(
                    () -> tick(active::get), 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
            runActive = active;
            running = true;
        }
        log.info("Starting job worker workerId={} pollInterval={} jobsPerTick={}", workerId, interval, jobsPerTick);
    }

    /**
     * Stop scheduling ticks and wait up to {@code shutdownTimeout} for the current one.
     * No-op when already stopped.
     */
    public void stop() {
        ScheduledExecutorService stopping;
        synchronized (lifecycleLock) {
            if (!running) {
                log.debug("Worker is not running workerId={}", workerId);
                return;
            }
            running = false;
            runActive.set(false);
            runActive = null;
            tickFuture.cancel(false);
            stopping = executor;
            stopping.shutdown();
            tickFuture = null;
            executor = null;
        }

        if (Thread.currentThread() == tickThread || JobScheduler.isHandlerThread()) {
            log.debug("Stop requested from a running job, not waiting workerId={}", workerId);
        } else {
            awaitCurrentTick(stopping);
        }
        log.info("Stopped job worker workerId={}", workerId);
    }

    private void awaitCurrentTick(ScheduledExecutorService stopping) {
        try {
            if (!stopping.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Current tick still running after shutdownTimeout={} workerId={}", shutdownTimeout, workerId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops the worker and releases the lease renewal thread; jobs run afterwards are not renewed.
     */
    @Override
    public void close() {
        stop();
        if (leaseRenewer != null) {
            leaseRenewer.shutdownNow();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Pure read for health checks. A queue that cannot be reached reports a size of -1.
     */
    public WorkerStatus getStatus() {
        long size;
        try {
            size = queue.getQueueSize();
        } catch (QueueUnavailableException e) {
            log.debug("Queue size unavailable msg={}", e.getMessage());
            size = -1L;
        }
        return new WorkerStatus(running, size);
    }

    void tick() {
        tick(() -> true);
    }

    private void tick(BooleanSupplier active) {
        tickThread = Thread.currentThread();
        try {
            for (int i = 0; i < jobsPerTick && active.getAsBoolean(); i++) {
                if (!processNextJob()) {
                    break;
                }
            }
        } catch (QueueUnavailableException e) {
            log.warn("Job queue unavailable, retrying next tick workerId={} msg={}", workerId, e.getMessage());
        } catch (Exception e) {
            log.error("Error processing job workerId={} msg={}", workerId, e.getMessage(), e);
        }
    }

    /**
     * Dequeue and run a single job on the calling thread.
     *
     * @return false when no job was ready
     */
    public boolean processNextJob() {
        Optional<QueuedJob> next = queue.dequeue();
        if (next.isEmpty()) {
            return false;
        }
        executeJob(next.get());
        return true;
    }

    private void executeJob(QueuedJob job) {
        long startedAt = System.nanoTime();
        log.info("Processing job jobId={} id={} attempt={}/{}",
                job.getJobId(), job.getId(), job.getAttemptNumber(), job.getMaxAttempts());

        ScheduledFuture<?> renewal = startLeaseRenewal(job);
        JobResult result;
        try {
            result = scheduler.execute(job.getJobId(), job.getData(), job.getAttemptNumber());
        } finally {
            if (renewal != null) {
                renewal.cancel(false);
            }
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        if (result.success()) {
            log.info("Job completed successfully jobId={} id={} durationMs={} result={}",
                    job.getJobId(), job.getId(), durationMs, result.data());
            queue.acknowledge(job);
            return;
        }
        handleFailure(job, result, durationMs);
    }

    private ScheduledFuture<?> startLeaseRenewal(QueuedJob job) {
        if (leaseRenewer == null) {
            return null;
        }
        long intervalMs = leaseRenewalInterval.toMillis();
        try {
            return leaseRenewer.scheduleWithFixedDelay(
                    () -> renewLease(job), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Lease renewal unavailable, worker closed jobId={} id={}", job.getJobId(), job.getId());
            return null;
        }
    }

    private void renewLease(QueuedJob job) {
        try {
            if (!queue.extendLease(job)) {
                log.warn("Lease no longer held jobId={} id={} workerId={}", job.getJobId(), job.getId(), workerId);
            }
        } catch (QueueUnavailableException e) {
            log.warn("Lease renewal failed, retrying jobId={} id={} msg={}", job.getJobId(), job.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Lease renewal error jobId={} id={} msg={}", job.getJobId(), job.getId(), e.getMessage(), e);
        }
    }

    private void handleFailure(QueuedJob job, JobResult result, long durationMs) {
        String error = result.errorOrDefault();
        log.error("Job failed jobId={} id={} attempt={}/{} durationMs={} failure={} error={}",
                job.getJobId(), job.getId(), job.getAttemptNumber(), job.getMaxAttempts(),
                durationMs, result.failureKind(), error);

        if (!job.isLastAttempt()) {
            int failedAttempt = job.getAttemptNumber();
            Instant nextAt = backoff.nextAttemptAt(retryPolicyFor(job.getJobId()), failedAttempt, clock.instant());
            job.scheduleRetry(error, nextAt);
            queue.requeue(job);
            log.info("Requeued job for retry jobId={} id={} nextAttempt={}/{} notBeforeAt={}",
                    job.getJobId(), job.getId(), job.getAttemptNumber(), job.getMaxAttempts(), nextAt);
            return;
        }

        job.markFailed(error);
        log.error("Job failed permanently after {} attempts jobId={} id={} finalError={}",
                job.getAttemptNumber(), job.getJobId(), job.getId(), error);
        recordDeadLetter(job, error);
        queue.acknowledge(job);
    }

    private void recordDeadLetter(QueuedJob job, String error) {
        try {
            deadLetterSink.record(job, error);
        } catch (Exception e) {
            log.error("Dead-letter record failed jobId={} id={} msg={}", job.getJobId(), job.getId(), e.getMessage(), e);
        }
    }

    private RetryPolicy retryPolicyFor(String jobId) {
        return scheduler.findDefinition(jobId)
                .<RetryPolicy>map(JobDefinition::retryPolicy)
                .orElse(defaultRetryPolicy);
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return d;
    }

    /** Builder for {@link JobWorker}. */
    public static final class Builder {
        private JobQueue queue;
        private JobScheduler scheduler;
        private DeadLetterSink deadLetterSink;
        private Backoff backoff;
        private RetryPolicy defaultRetryPolicy;
        private Clock clock;
        private Logger log;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private int jobsPerTick = 1;
        private String workerId;
        private Duration leaseRenewalInterval;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder queue(JobQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder scheduler(JobScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Optional. Defaults to {@link LoggingDeadLetterSink}.
         */
        public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
            this.deadLetterSink = deadLetterSink;
            return this;
        }

        public Builder backoff(Backoff backoff) {
            this.backoff = backoff;
            return this;
        }

        /**
         * Policy for jobs whose definition is not registered in this process.
         * Optional. Defaults to {@link RetryPolicy#defaults()}.
         */
        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = defaultRetryPolicy;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder logger(Logger log) {
            this.log = log;
            return this;
        }

        /**
         * Optional. Defaults to 1 second.
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * How long {@link #stop()} waits for the current tick. Optional. Defaults to 30 seconds.
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * Upper bound of jobs processed per tick. Optional. Defaults to 1.
         */
        public Builder jobsPerTick(int jobsPerTick) {
            this.jobsPerTick = jobsPerTick;
            return this;
        }

        /**
         * Optional. Generated from host, pid and a UUID when blank.
         */
        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        /**
         * How often the lease of a running job is extended, well below the queue's lease
         * lifetime. Optional. No renewal when unset.
         */
        public Builder leaseRenewalInterval(Duration leaseRenewalInterval) {
            this.leaseRenewalInterval = leaseRenewalInterval;
            return this;
        }

        public JobWorker build() {
            return new JobWorker(this);
        }
    }
}
