package io.jobs4j.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueuedJobTest {

    private static final Instant NOW = Instant.parse("2026-02-01T08:00:00Z");

    @Test
    void newJobShouldStartAtFirstAttempt() {
        QueuedJob job = QueuedJob.newJob("send-notifications", Map.of("k", "v"), Priority.HIGH, 3, NOW, null);

        assertEquals(1, job.getAttemptNumber());
        assertEquals(3, job.getMaxAttempts());
        assertEquals(NOW, job.getNotBeforeAt());
        assertNull(job.getLastError());
        assertTrue(job.isReady(NOW));
        assertFalse(job.isLastAttempt());
    }

    @Test
    void scheduleRetryShouldAdvanceAttemptAndDelay() {
        QueuedJob job = QueuedJob.newJob("send-notifications", null, Priority.NORMAL, 2, NOW, NOW);

        job.scheduleRetry("smtp down", NOW.plusSeconds(1));

        assertEquals(2, job.getAttemptNumber());
        assertEquals("smtp down", job.getLastError());
        assertFalse(job.isReady(NOW));
        assertTrue(job.isReady(NOW.plusSeconds(1)));
        assertTrue(job.isLastAttempt());
    }

    @Test
    void scheduleRetryShouldRefuseWhenBudgetIsSpent() {
        QueuedJob job = QueuedJob.newJob("send-notifications", null, Priority.NORMAL, 1, NOW, NOW);

        assertThrows(IllegalStateException.class, () -> job.scheduleRetry("again", NOW));
        assertEquals(1, job.getAttemptNumber());
    }

    @Test
    void markFailedShouldKeepAttemptNumber() {
        QueuedJob job = QueuedJob.newJob("send-notifications", null, Priority.NORMAL, 1, NOW, NOW);

        job.markFailed("final");

        assertEquals(1, job.getAttemptNumber());
        assertEquals("final", job.getLastError());
    }

    @Test
    void constructorShouldRejectAttemptOutsideBudget() {
        assertThrows(IllegalArgumentException.class,
                () -> new QueuedJob("id", "job", null, Priority.NORMAL, 4, 3, NOW, NOW, null, 0L));
        assertThrows(IllegalArgumentException.class,
                () -> new QueuedJob("id", "job", null, Priority.NORMAL, 0, 3, NOW, NOW, null, 0L));
    }
}
