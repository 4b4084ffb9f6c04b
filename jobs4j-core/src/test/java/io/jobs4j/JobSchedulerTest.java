package io.jobs4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.core.DuplicateRegistrationException;
import io.jobs4j.core.FailureKind;
import io.jobs4j.core.JobContext;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobDefinitionRegistry;
import io.jobs4j.core.JobResult;
import io.jobs4j.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobSchedulerTest {

    public static class NotificationPayload {
        public String userId;
        public String message;
    }

    private static final Instant NOW = Instant.parse("2026-04-01T10:00:00Z");

    private final ILoggerFactory loggerFactory = mock(ILoggerFactory.class);
    private final Logger jobLogger = mock(Logger.class);
    private final JobScheduler scheduler = new JobScheduler(
            new JobDefinitionRegistry(),
            new ObjectMapper(),
            null,
            new MutableClock(NOW),
            loggerFactory,
            LoggerFactory.getLogger(JobSchedulerTest.class)
    );

    JobSchedulerTest() {
        when(loggerFactory.getLogger(anyString())).thenReturn(jobLogger);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void executeShouldPassContextToHandler() {
        AtomicReference<JobContext<NotificationPayload>> seen = new AtomicReference<>();
        scheduler.register(
                JobDefinition.builder("send-notifications", NotificationPayload.class).build(),
                ctx -> {
                    seen.set(ctx);
                    ctx.logger().info("sending to {}", ctx.data().userId);
                    return JobResult.success(Map.of("delivered", true));
                });

        JobResult result = scheduler.execute("send-notifications", Map.of("userId", "u-1", "message", "hi"), 2);

        assertTrue(result.success());
        assertEquals(Map.of("delivered", true), result.data());
        assertEquals("send-notifications", seen.get().jobId());
        assertEquals(2, seen.get().attemptNumber());
        assertEquals(NOW, seen.get().scheduledAt());
        assertEquals("u-1", seen.get().data().userId);
        assertSame(jobLogger, seen.get().logger());
        verify(loggerFactory).getLogger("jobs4j.job.send-notifications");
    }

    @Test
    void handlerFailureShouldBeReturnedAsIs() {
        scheduler.register(JobDefinition.builder("generate-ai-content").build(),
                ctx -> JobResult.failure("model unavailable"));

        JobResult result = scheduler.execute("generate-ai-content", null, 1);

        assertFalse(result.success());
        assertEquals("model unavailable", result.error());
        assertEquals(FailureKind.HANDLER_FAILURE, result.failureKind());
    }

    @Test
    void thrownExceptionShouldBecomeFault() {
        scheduler.register(JobDefinition.builder("process-campaign-data").build(), ctx -> {
            throw new IllegalStateException("db down");
        });

        JobResult result = scheduler.execute("process-campaign-data", Map.of(), 1);

        assertFalse(result.success());
        assertEquals("db down", result.error());
        assertEquals(FailureKind.HANDLER_FAULT, result.failureKind());
    }

    @Test
    void exceptionWithoutMessageShouldUseClassName() {
        scheduler.register(JobDefinition.builder("npe").build(), ctx -> {
            throw new NullPointerException();
        });

        assertEquals(NullPointerException.class.getName(), scheduler.execute("npe", null, 1).error());
    }

    @Test
    void slowHandlerShouldTimeOut() {
        CountDownLatch release = new CountDownLatch(1);
        scheduler.register(
                JobDefinition.builder("slow").timeout(Duration.ofMillis(100)).build(),
                ctx -> {
                    release.await(5, TimeUnit.SECONDS);
                    return JobResult.ok();
                });

        long started = System.nanoTime();
        JobResult result = scheduler.execute("slow", null, 1);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        release.countDown();

        assertFalse(result.success());
        assertEquals("timeout", result.error());
        assertEquals(FailureKind.TIMEOUT, result.failureKind());
        assertTrue(elapsedMs < 2000, "returned after " + elapsedMs + "ms");
    }

    @Test
    @SuppressWarnings("unchecked")
    void timeoutShouldKeepSubMillisecondPrecision() throws Exception {
        ExecutorService executor = mock(ExecutorService.class);
        Future<JobResult> future = mock(Future.class);
        when(executor.submit(ArgumentMatchers.<Callable<JobResult>>any())).thenReturn(future);
        when(future.get(anyLong(), any(TimeUnit.class))).thenReturn(JobResult.ok());
        JobScheduler precise = new JobScheduler(new JobDefinitionRegistry(), new ObjectMapper(), executor,
                new MutableClock(NOW), loggerFactory, LoggerFactory.getLogger(JobSchedulerTest.class));
        precise.register(JobDefinition.builder("tight").timeout(Duration.ofNanos(900_000)).build(), ctx -> JobResult.ok());

        assertTrue(precise.execute("tight", null, 1).success());

        verify(future).get(900_000L, TimeUnit.NANOSECONDS);
    }

    @Test
    void saturatedHandlerPoolShouldFailFast() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean release = new AtomicBoolean();
        try (JobScheduler single = new JobScheduler(new ObjectMapper(), 1)) {
            single.register(JobDefinition.builder("stubborn").timeout(Duration.ofMillis(200)).build(), ctx -> {
                started.countDown();
                while (!release.get()) {
                    Thread.onSpinWait();
                }
                return JobResult.ok();
            });
            single.register(JobDefinition.builder("quick").build(), ctx -> JobResult.ok());

            assertEquals(FailureKind.TIMEOUT, single.execute("stubborn", null, 1).failureKind());
            assertTrue(started.await(5, TimeUnit.SECONDS));

            JobResult rejected = single.execute("quick", null, 1);
            release.set(true);

            assertFalse(rejected.success());
            assertEquals(FailureKind.HANDLER_FAULT, rejected.failureKind());
            assertTrue(rejected.error().startsWith("Handler executor rejected the job"), rejected.error());
        }
    }

    @Test
    void handlerThreadShouldBeMarked() {
        AtomicBoolean insideHandler = new AtomicBoolean();
        scheduler.register(JobDefinition.builder("marker").build(), ctx -> {
            insideHandler.set(JobScheduler.isHandlerThread());
            return JobResult.ok();
        });

        scheduler.execute("marker", null, 1);

        assertTrue(insideHandler.get());
        assertFalse(JobScheduler.isHandlerThread());
    }

    @Test
    void unknownJobShouldNotThrow() {
        JobResult result = scheduler.execute("missing", null, 1);

        assertFalse(result.success());
        assertEquals("No job registered for id: missing", result.error());
        assertEquals(FailureKind.UNKNOWN_JOB, result.failureKind());
    }

    @Test
    void mismatchedPayloadShouldNotReachHandler() {
        scheduler.register(JobDefinition.builder("send-notifications", NotificationPayload.class).build(),
                ctx -> {
                    throw new AssertionError("handler must not run");
                });

        JobResult result = scheduler.execute("send-notifications", List.of(1, 2), 1);

        assertFalse(result.success());
        assertEquals(FailureKind.INVALID_PAYLOAD, result.failureKind());
    }

    @Test
    void nullResultShouldBeFault() {
        scheduler.register(JobDefinition.builder("silent").build(), ctx -> null);

        JobResult result = scheduler.execute("silent", null, 1);

        assertFalse(result.success());
        assertEquals("Handler returned no result", result.error());
    }

    @Test
    void duplicateRegistrationShouldFail() {
        scheduler.register(JobDefinition.builder("calculate-metrics").build(), ctx -> JobResult.ok());

        assertThrows(DuplicateRegistrationException.class,
                () -> scheduler.register(JobDefinition.builder("calculate-metrics").build(), ctx -> JobResult.ok()));
        assertEquals(List.of("calculate-metrics"), scheduler.getRegisteredJobs());
    }

    @Test
    void registeredJobsShouldBeListed() {
        scheduler.register(JobDefinition.builder("b").build(), ctx -> JobResult.ok());
        scheduler.register(JobDefinition.builder("a").build(), ctx -> JobResult.ok());

        assertEquals(List.of("a", "b"), scheduler.getRegisteredJobs());
        assertTrue(scheduler.findDefinition("a").isPresent());
        assertTrue(scheduler.findDefinition("c").isEmpty());
    }
}
