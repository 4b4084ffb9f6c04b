package io.jobs4j.core;

/**
 * A payload does not match the shape declared by its {@link JobDefinition}.
 */
public class InvalidPayloadException extends JobException {

    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
