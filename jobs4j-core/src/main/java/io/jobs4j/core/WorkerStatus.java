package io.jobs4j.core;

/**
 * Health snapshot of a worker.
 *
 * @param running   whether the polling loop is active
 * @param queueSize approximate number of jobs not yet completed
 */
public record WorkerStatus(boolean running, long queueSize) {
}
