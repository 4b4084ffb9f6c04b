package io.jobs4j.core;

public class UnknownJobException extends JobException {

    private final String jobId;

    public UnknownJobException(String jobId) {
        super("No job registered for id: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
