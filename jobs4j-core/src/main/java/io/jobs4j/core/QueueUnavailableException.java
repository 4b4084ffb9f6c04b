package io.jobs4j.core;

/**
 * The backing store of a {@code JobQueue} could not be reached.
 *
 * <p>Workers log it and try again on their next tick.
 */
public class QueueUnavailableException extends JobException {

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
