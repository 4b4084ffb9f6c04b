package io.jobs4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.core.DuplicateRegistrationException;
import io.jobs4j.core.InvalidPayloadException;
import io.jobs4j.core.JobContext;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobDefinitionRegistry;
import io.jobs4j.core.JobRegistration;
import io.jobs4j.core.JobResult;
import io.jobs4j.core.PayloadCodec;
import io.jobs4j.utils.DaemonThreadFactory;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Binds job ids to handlers and runs one attempt at a time.
 *
 * <p>{@link #execute} never throws for per-job problems: an unknown id, a payload that does
 * not fit the definition, a handler exception and a timeout all come back as a failed
 * {@link JobResult} tagged with its {@link io.jobs4j.core.FailureKind}.
 *
 * <p>Handlers run on a separate executor so the caller can stop waiting when the definition's
 * timeout elapses. The abandoned handler is interrupted but may still finish its side effects;
 * its eventual result is discarded. The executor this class creates itself is bounded: once
 * {@code maxHandlerThreads} handlers are busy, further attempts fail fast as a fault instead of
 * piling up threads behind handlers that ignore interruption.
 */
public class JobScheduler implements AutoCloseable {
    public static final int DEFAULT_MAX_HANDLER_THREADS = 10;

    private static final String JOB_LOGGER_PREFIX = "jobs4j.job.";
    private static final ThreadLocal<Boolean> HANDLER_THREAD = new ThreadLocal<>();

    private final JobDefinitionRegistry registry;
    private final PayloadCodec payloadCodec;
    private final ExecutorService handlerExecutor;
    private final boolean ownsExecutor;
    private final Clock clock;
    private final ILoggerFactory loggerFactory;
    private final Logger log;

    public JobScheduler() {
        this(new ObjectMapper());
    }

    public JobScheduler(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_MAX_HANDLER_THREADS);
    }

    /**
     * @param maxHandlerThreads upper bound of handlers running at once, abandoned ones included
     */
    public JobScheduler(ObjectMapper objectMapper, int maxHandlerThreads) {
        this(new JobDefinitionRegistry(), objectMapper, newHandlerExecutor(maxHandlerThreads), true, Clock.systemUTC(),
                LoggerFactory.getILoggerFactory(), LoggerFactory.getLogger(JobScheduler.class));
    }

    /**
     * @param handlerExecutor executor running handlers; when null a bounded daemon pool of
     *                        {@link #DEFAULT_MAX_HANDLER_THREADS} threads is created and shut down
     *                        by {@link #close()}
     * @param loggerFactory   source of the per-job loggers handed to handlers
     */
    public JobScheduler(JobDefinitionRegistry registry,
                        ObjectMapper objectMapper,
                        ExecutorService handlerExecutor,
                        Clock clock,
                        ILoggerFactory loggerFactory,
                        Logger log) {
        this(registry, objectMapper,
                handlerExecutor != null ? handlerExecutor : newHandlerExecutor(DEFAULT_MAX_HANDLER_THREADS),
                handlerExecutor == null, clock, loggerFactory, log);
    }

    private JobScheduler(JobDefinitionRegistry registry,
                         ObjectMapper objectMapper,
                         ExecutorService handlerExecutor,
                         boolean ownsExecutor,
                         Clock clock,
                         ILoggerFactory loggerFactory,
                         Logger log) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.payloadCodec = new PayloadCodec(Objects.requireNonNull(objectMapper, "objectMapper must not be null"));
        this.handlerExecutor = handlerExecutor;
        this.ownsExecutor = ownsExecutor;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.loggerFactory = Objects.requireNonNull(loggerFactory, "loggerFactory must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    /**
     * Daemon pool with no queue: a submit beyond {@code maxThreads} busy handlers is rejected.
     */
    public static ExecutorService newHandlerExecutor(int maxThreads) {
        if (maxThreads < 1) {
            throw new IllegalArgumentException("maxThreads must be >= 1");
        }
        return new ThreadPoolExecutor(0, maxThreads, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new DaemonThreadFactory("jobs4j-handler-"));
    }

    /**
     * True while the calling thread is running a handler submitted by a {@code JobScheduler}.
     */
    public static boolean isHandlerThread() {
        return Boolean.TRUE.equals(HANDLER_THREAD.get());
    }

    /**
     * @throws DuplicateRegistrationException if the definition id is already bound
     */
    public <T> void register(JobDefinition<T> definition, JobHandler<T> handler) {
        register(JobRegistration.of(definition, handler));
    }

    public void register(JobRegistration<?> registration) {
        registry.add(registration);
        JobDefinition<?> def = registration.definition();
        log.info("Registered job jobId={} priority={} timeout={} maxAttempts={} schedule={}",
                def.id(), def.priority(), def.timeout(), def.retryPolicy().maxAttempts(), def.schedule());
    }

    /**
     * Runs one attempt of {@code jobId} with its stored payload.
     *
     * @param data          stored payload as produced by {@link PayloadCodec#toStored(Object)}
     * @param attemptNumber 1-based attempt number reported to the handler
     */
    public JobResult execute(String jobId, Object data, int attemptNumber) {
        Optional<JobRegistration<?>> registration = registry.find(jobId);
        if (registration.isEmpty()) {
            log.warn("No handler registered for jobId={}", jobId);
            return JobResult.unknownJob(jobId);
        }
        return executeRegistered(registration.get(), data, attemptNumber);
    }

    private <T> JobResult executeRegistered(JobRegistration<T> registration, Object data, int attemptNumber) {
        JobDefinition<T> definition = registration.definition();
        String jobId = definition.id();

        T payload;
        try {
            payload = payloadCodec.fromStored(data, definition.payloadType());
        } catch (InvalidPayloadException e) {
            log.error("Job payload rejected jobId={} msg={}", jobId, e.getMessage());
            return JobResult.invalidPayload(e.getMessage());
        }

        JobContext<T> context = new JobContext<>(
                jobId,
                attemptNumber,
                clock.instant(),
                payload,
                loggerFactory.getLogger(JOB_LOGGER_PREFIX + jobId)
        );

        log.info("Executing job jobId={} attempt={}", jobId, attemptNumber);

        Future<JobResult> future;
        try {
            future = handlerExecutor.submit(() -> runHandler(registration.handler(), context));
        } catch (RejectedExecutionException e) {
            log.error("Handler executor rejected jobId={} msg={}", jobId, e.getMessage());
            return JobResult.fault("Handler executor rejected the job: " + e.getMessage());
        }

        JobResult result;
        try {
            result = definition.hasTimeout()
                    ? future.get(definition.timeout().toNanos(), TimeUnit.NANOSECONDS)
                    : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Job timed out jobId={} attempt={} timeout={}", jobId, attemptNumber, definition.timeout());
            return JobResult.timeout();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Job threw an error jobId={} attempt={} msg={}", jobId, attemptNumber, cause.getMessage(), cause);
            return JobResult.fault(messageOf(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for jobId={}", jobId);
            return JobResult.fault("Interrupted while waiting for the handler");
        }

        if (result == null) {
            log.error("Job returned no result jobId={} attempt={}", jobId, attemptNumber);
            return JobResult.fault("Handler returned no result");
        }

        if (result.success()) {
            log.info("Job completed successfully jobId={} attempt={}", jobId, attemptNumber);
        } else {
            log.error("Job failed jobId={} attempt={} error={}", jobId, attemptNumber, result.error());
        }
        return result;
    }

    private static <T> JobResult runHandler(JobHandler<T> handler, JobContext<T> context) throws Exception {
        HANDLER_THREAD.set(Boolean.TRUE);
        try {
            return handler.execute(context);
        } finally {
            HANDLER_THREAD.remove();
        }
    }

    public List<String> getRegisteredJobs() {
        return registry.ids();
    }

    public Optional<JobDefinition<?>> findDefinition(String jobId) {
        return registry.findDefinition(jobId);
    }

    public JobDefinitionRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            handlerExecutor.shutdownNow();
        }
    }

    private static String messageOf(Throwable t) {
        String message = t.getMessage();
        return (message == null || message.isBlank()) ? t.getClass().getName() : message;
    }
}
