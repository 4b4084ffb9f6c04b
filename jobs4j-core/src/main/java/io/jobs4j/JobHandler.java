package io.jobs4j;

import io.jobs4j.core.JobContext;
import io.jobs4j.core.JobResult;

/**
 * Business logic bound to one job kind.
 *
 * <p>Handlers may be abandoned by a timeout while their side effects are still running,
 * so they must be idempotent.
 */
@FunctionalInterface
public interface JobHandler<T> {

    JobResult execute(JobContext<T> context) throws Exception;
}
