package io.jobs4j.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of job kinds and their handlers, keyed by job id.
 *
 * <p>Filled once during start-up; reads afterwards need no locking.
 */
public class JobDefinitionRegistry {

    private final Map<String, JobRegistration<?>> registrationsById = new ConcurrentHashMap<>();

    public JobDefinitionRegistry() {
    }

    public JobDefinitionRegistry(List<JobRegistration<?>> registrations) {
        registrations.forEach(this::add);
    }

    /**
     * @throws DuplicateRegistrationException if the id is already bound
     */
    public void add(JobRegistration<?> registration) {
        JobRegistration<?> existing = registrationsById.putIfAbsent(registration.jobId(), registration);
        if (existing != null) {
            throw new DuplicateRegistrationException(registration.jobId());
        }
    }

    public Optional<JobRegistration<?>> find(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registrationsById.get(jobId));
    }

    public JobRegistration<?> getRequired(String jobId) {
        return find(jobId).orElseThrow(() -> new UnknownJobException(jobId));
    }

    public Optional<JobDefinition<?>> findDefinition(String jobId) {
        return find(jobId).<JobDefinition<?>>map(JobRegistration::definition);
    }

    public List<String> ids() {
        return registrationsById.keySet().stream().sorted().toList();
    }

    public int size() {
        return registrationsById.size();
    }
}
