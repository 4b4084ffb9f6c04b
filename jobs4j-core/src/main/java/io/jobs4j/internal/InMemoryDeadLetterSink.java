package io.jobs4j.internal;

import io.jobs4j.DeadLetterSink;
import io.jobs4j.core.QueuedJob;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps dead jobs in memory, oldest first. Meant for tests and embedded use.
 */
public class InMemoryDeadLetterSink implements DeadLetterSink {

    public record Entry(QueuedJob job, String finalError, Instant recordedAt) {
    }

    private final List<Entry> entries = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryDeadLetterSink() {
        this(Clock.systemUTC());
    }

    public InMemoryDeadLetterSink(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void record(QueuedJob job, String finalError) {
        entries.add(new Entry(job, finalError, clock.instant()));
    }

    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    public List<Entry> entriesFor(String jobId) {
        return entries.stream().filter(e -> e.job().getJobId().equals(jobId)).toList();
    }

    public int size() {
        return entries.size();
    }
}
