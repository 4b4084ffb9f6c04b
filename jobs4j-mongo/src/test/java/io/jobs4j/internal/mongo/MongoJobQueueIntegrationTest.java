package io.jobs4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.jobs4j.JobEnqueuer;
import io.jobs4j.JobScheduler;
import io.jobs4j.JobWorker;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobResult;
import io.jobs4j.core.Priority;
import io.jobs4j.core.QueuedJob;
import io.jobs4j.core.QueuedJobStatus;
import io.jobs4j.core.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobQueueIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private MongoClient client;
    private MongoTemplate mongoTemplate;

    @BeforeEach
    void setUp() {
        client = MongoClients.create(MONGO.getReplicaSetUrl());
        mongoTemplate = new MongoTemplate(client, "jobs4j_test");
        dropAll();
    }

    @AfterEach
    void tearDown() {
        dropAll();
        client.close();
    }

    private void dropAll() {
        mongoTemplate.dropCollection(QueuedJobDocument.class);
        mongoTemplate.dropCollection(DeadJobDocument.class);
        mongoTemplate.dropCollection(JobSequenceDocument.class);
    }

    private MongoJobQueue queue(String workerId, Instant at, Duration lease) {
        return new MongoJobQueue(mongoTemplate, lease, workerId, Clock.fixed(at, ZoneOffset.UTC),
                LoggerFactory.getLogger(MongoJobQueue.class));
    }

    private static QueuedJob job(String jobId, Priority priority, Instant notBefore) {
        return QueuedJob.newJob(jobId, Map.of("k", "v"), priority, 3, NOW, notBefore);
    }

    @Test
    void dequeueShouldLeaseAndPreventDoubleClaim() {
        MongoJobQueue workerA = queue("worker-A", NOW, Duration.ofSeconds(30));
        MongoJobQueue workerB = queue("worker-B", NOW, Duration.ofSeconds(30));
        workerA.enqueue(job("send-notifications", Priority.NORMAL, NOW));

        QueuedJob claimed = workerA.dequeue().orElseThrow();
        assertEquals("send-notifications", claimed.getJobId());
        assertEquals(Map.of("k", "v"), claimed.getData());

        QueuedJobDocument stored = mongoTemplate.findById(claimed.getId(), QueuedJobDocument.class);
        assertNotNull(stored);
        assertEquals("worker-A", stored.getLockedBy());
        assertEquals(NOW.plusSeconds(30), stored.getLockUntil());

        assertTrue(workerB.dequeue().isEmpty());
        assertEquals(1, workerB.getQueueSize());
    }

    @Test
    void dequeueShouldFollowPriorityThenFifo() {
        MongoJobQueue q = queue("worker-A", NOW, Duration.ofSeconds(30));
        q.enqueue(job("low", Priority.LOW, NOW));
        q.enqueue(job("normal-1", Priority.NORMAL, NOW));
        q.enqueue(job("urgent", Priority.URGENT, NOW));
        q.enqueue(job("normal-2", Priority.NORMAL, NOW));
        q.enqueue(job("later", Priority.URGENT, NOW.plusSeconds(60)));

        List<String> order = new ArrayList<>();
        Optional<QueuedJob> next;
        while ((next = q.dequeue()).isPresent()) {
            order.add(next.get().getJobId());
        }

        assertEquals(List.of("urgent", "normal-1", "normal-2", "low"), order);
        assertTrue(queue("worker-A", NOW.plusSeconds(60), Duration.ofSeconds(30)).dequeue().isPresent());
    }

    @Test
    void expiredLeaseShouldMakeJobClaimableAgain() {
        MongoJobQueue workerA = queue("worker-A", NOW, Duration.ofSeconds(5));
        workerA.enqueue(job("process-campaign-data", Priority.HIGH, NOW));
        QueuedJob first = workerA.dequeue().orElseThrow();

        MongoJobQueue workerB = queue("worker-B", NOW.plusSeconds(5), Duration.ofSeconds(5));
        QueuedJob reclaimed = workerB.dequeue().orElseThrow();
        assertEquals(first.getId(), reclaimed.getId());
        assertEquals(1, reclaimed.getAttemptNumber());

        workerA.acknowledge(first);
        assertEquals(1, workerB.getQueueSize());

        workerB.acknowledge(reclaimed);
        assertEquals(0, workerB.getQueueSize());
    }

    @Test
    void extendedLeaseShouldKeepRunningJobFromOtherWorkers() {
        MongoJobQueue workerA = queue("worker-A", NOW, Duration.ofSeconds(5));
        workerA.enqueue(job("rebuild-index", Priority.NORMAL, NOW));
        QueuedJob running = workerA.dequeue().orElseThrow();

        assertTrue(queue("worker-A", NOW.plusSeconds(4), Duration.ofSeconds(5)).extendLease(running));
        QueuedJobDocument stored = mongoTemplate.findById(running.getId(), QueuedJobDocument.class);
        assertNotNull(stored);
        assertEquals(NOW.plusSeconds(9), stored.getLockUntil());

        MongoJobQueue workerB = queue("worker-B", NOW.plusSeconds(5), Duration.ofSeconds(5));
        assertTrue(workerB.dequeue().isEmpty());
        assertFalse(workerB.extendLease(running));
        assertEquals(QueuedJobStatus.LEASED, workerB.getJobStatus(running.getId()));

        QueuedJob reclaimed = queue("worker-B", NOW.plusSeconds(9), Duration.ofSeconds(5)).dequeue().orElseThrow();
        assertEquals(running.getId(), reclaimed.getId());
        assertFalse(queue("worker-A", NOW.plusSeconds(10), Duration.ofSeconds(5)).extendLease(running));
    }

    @Test
    void inspectionShouldIgnoreLeasedJobs() {
        MongoJobQueue q = queue("worker-A", NOW, Duration.ofSeconds(30));
        QueuedJob urgent = job("urgent", Priority.URGENT, NOW);
        QueuedJob low = job("low", Priority.LOW, NOW);
        QueuedJob later = job("later", Priority.HIGH, NOW.plusSeconds(60));
        QueuedJob normal = job("normal", Priority.NORMAL, NOW);
        q.enqueue(urgent);
        q.enqueue(low);
        q.enqueue(later);
        q.enqueue(normal);

        assertEquals("urgent", q.peek().orElseThrow().getJobId());
        assertEquals(QueuedJobStatus.QUEUED, q.getJobStatus(urgent.getId()));
        q.dequeue().orElseThrow();

        assertEquals("normal", q.peek().orElseThrow().getJobId());
        assertEquals(List.of("later", "normal", "low"),
                q.getQueuedJobs().stream().map(QueuedJob::getJobId).toList());
        assertEquals(QueuedJobStatus.LEASED, q.getJobStatus(urgent.getId()));
        assertEquals(QueuedJobStatus.NOT_FOUND, q.getJobStatus("missing"));

        assertEquals(3, q.clear());
        assertEquals(1, q.getQueueSize());
        assertTrue(q.peek().isEmpty());
        assertEquals(QueuedJobStatus.LEASED, q.getJobStatus(urgent.getId()));
    }

    @Test
    void requeueShouldPersistRetryStateAndReleaseLease() {
        MongoJobQueue q = queue("worker-A", NOW, Duration.ofSeconds(30));
        q.enqueue(job("generate-ai-content", Priority.NORMAL, NOW));
        QueuedJob leased = q.dequeue().orElseThrow();
        long sequence = leased.getSequence();

        leased.scheduleRetry("model unavailable", NOW.plusSeconds(2));
        q.requeue(leased);

        QueuedJobDocument stored = mongoTemplate.findById(leased.getId(), QueuedJobDocument.class);
        assertNotNull(stored);
        assertEquals(2, stored.getAttemptNumber());
        assertEquals("model unavailable", stored.getLastError());
        assertNull(stored.getLockedBy());
        assertEquals(sequence, stored.getSequence());

        assertTrue(q.dequeue().isEmpty());
        QueuedJob retried = queue("worker-A", NOW.plusSeconds(2), Duration.ofSeconds(30)).dequeue().orElseThrow();
        assertEquals(2, retried.getAttemptNumber());
    }

    @Test
    void removeShouldSkipLeasedJobs() {
        MongoJobQueue q = queue("worker-A", NOW, Duration.ofSeconds(30));
        QueuedJob leasedJob = job("a", Priority.URGENT, NOW);
        QueuedJob pending = job("b", Priority.LOW, NOW);
        q.enqueue(leasedJob);
        q.enqueue(pending);
        q.dequeue().orElseThrow();

        assertFalse(q.remove(leasedJob.getId()));
        assertTrue(q.remove(pending.getId()));
        assertEquals(1, q.getQueueSize());
    }

    @Test
    void sequencesShouldIncrease() {
        MongoJobQueue q = queue("worker-A", NOW, Duration.ofSeconds(30));
        QueuedJob a = job("a", Priority.NORMAL, NOW);
        QueuedJob b = job("b", Priority.NORMAL, NOW);
        q.enqueue(a);
        q.enqueue(b);

        assertTrue(b.getSequence() > a.getSequence());
    }

    @Test
    void deadLetterSinkShouldRecordFindAndReplay() {
        MongoJobQueue q = queue("worker-A", NOW, Duration.ofSeconds(30));
        MongoDeadLetterSink sink = new MongoDeadLetterSink(mongoTemplate, Clock.fixed(NOW, ZoneOffset.UTC),
                LoggerFactory.getLogger(MongoDeadLetterSink.class));
        QueuedJob dead = QueuedJob.newJob("calculate-metrics", Map.of("range", "6h"), Priority.LOW, 1, NOW, NOW);
        dead.markFailed("db down");

        sink.record(dead, "db down");
        sink.record(dead, "db down");

        assertEquals(1, sink.count("calculate-metrics"));
        assertEquals(0, sink.count("other"));
        DeadJobDocument doc = sink.find(null, 10).get(0);
        assertEquals("db down", doc.getFinalError());
        assertEquals(NOW, doc.getFailedAt());

        QueuedJob replayed = sink.replay(dead.getId(), q).orElseThrow();
        assertNotEquals(dead.getId(), replayed.getId());
        assertEquals(1, replayed.getAttemptNumber());
        assertEquals(Priority.LOW, replayed.getPriority());
        assertEquals(0, sink.count(null));
        assertEquals(1, q.getQueueSize());
        assertTrue(sink.replay("missing", q).isEmpty());
    }

    @Test
    void failingJobShouldEndInDeadJobsAfterMaxAttempts() throws Exception {
        ObjectMapper om = new ObjectMapper();
        MongoJobQueue q = new MongoJobQueue(mongoTemplate, Duration.ofSeconds(30), "worker-A");
        MongoDeadLetterSink sink = new MongoDeadLetterSink(mongoTemplate);
        JobScheduler scheduler = new JobScheduler(om);
        scheduler.register(
                JobDefinition.builder("failing-job")
                        .retryPolicy(RetryPolicy.fixed(3, Duration.ofMillis(10)))
                        .build(),
                ctx -> {
                    throw new IllegalStateException("simulated failure");
                });
        new JobEnqueuer(scheduler, q, om).enqueue("failing-job", Map.of("id", "A1"));

        JobWorker worker = JobWorker.builder()
                .queue(q)
                .scheduler(scheduler)
                .deadLetterSink(sink)
                .pollInterval(Duration.ofMillis(50))
                .build();
        worker.start();
        boolean reached = waitUntil(8, TimeUnit.SECONDS, () -> sink.count("failing-job") == 1);
        worker.stop();
        scheduler.close();

        assertTrue(reached);
        DeadJobDocument doc = sink.find("failing-job", 1).get(0);
        assertEquals(3, doc.getAttemptNumber());
        assertEquals("simulated failure", doc.getFinalError());
        assertEquals(0, q.getQueueSize());
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
