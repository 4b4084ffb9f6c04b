package io.jobs4j.core;

/**
 * Two handlers claimed the same job id. Raised during start-up and never retried.
 */
public class DuplicateRegistrationException extends JobException {

    private final String jobId;

    public DuplicateRegistrationException(String jobId) {
        super("Duplicate job registration: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
