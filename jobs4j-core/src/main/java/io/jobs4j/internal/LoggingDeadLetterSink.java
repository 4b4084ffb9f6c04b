package io.jobs4j.internal;

import io.jobs4j.DeadLetterSink;
import io.jobs4j.core.QueuedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink that only writes dead jobs to the log. Default when nothing durable is configured.
 */
public class LoggingDeadLetterSink implements DeadLetterSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterSink.class);

    @Override
    public void record(QueuedJob job, String finalError) {
        log.error("dead job jobId={} id={} attempts={}/{} data={} error={}",
                job.getJobId(),
                job.getId(),
                job.getAttemptNumber(),
                job.getMaxAttempts(),
                job.getData(),
                finalError);
    }
}
