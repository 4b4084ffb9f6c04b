package io.jobs4j.core;

import io.jobs4j.JobHandler;

import java.util.Objects;

/**
 * A definition paired with its handler. Spring applications expose these as beans.
 */
public record JobRegistration<T>(JobDefinition<T> definition, JobHandler<T> handler) {

    public JobRegistration {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
    }

    public static <T> JobRegistration<T> of(JobDefinition<T> definition, JobHandler<T> handler) {
        return new JobRegistration<>(definition, handler);
    }

    public String jobId() {
        return definition.id();
    }
}
