package io.jobs4j.core;

/**
 * Checks a typed payload before it is enqueued.
 */
@FunctionalInterface
public interface PayloadValidator<T> {

    /**
     * @throws InvalidPayloadException when the payload must not be enqueued
     */
    void validate(T payload);

    static <T> PayloadValidator<T> none() {
        return payload -> {
        };
    }
}
