package io.jobs4j.config;

import io.jobs4j.core.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the job worker and its Mongo store.
 */
@ConfigurationProperties(prefix = "jobs")
public class JobsProperties {
    private boolean enabled = true;
    private String workerId;
    private Duration pollInterval = Duration.ofSeconds(1);
    private int jobsPerTick = 1;
    private Duration leaseLifetime = Duration.ofMinutes(10);
    private int handlerThreads = 10;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private int defaultMaxAttempts = 3;
    private Duration defaultInitialDelay = Duration.ofSeconds(1);
    private Duration defaultMaxDelay = Duration.ofSeconds(30);
    private boolean startWorker = true;
    private boolean ensureIndexesOnStartup = false;

    /**
     * Exponential policy built from the {@code default-*} values, applied to jobs whose
     * definition is not registered in this process.
     */
    public RetryPolicy defaultRetryPolicy() {
        return RetryPolicy.exponential(defaultMaxAttempts, defaultInitialDelay, defaultMaxDelay);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getJobsPerTick() {
        return jobsPerTick;
    }

    public void setJobsPerTick(int jobsPerTick) {
        this.jobsPerTick = jobsPerTick;
    }

    public Duration getLeaseLifetime() {
        return leaseLifetime;
    }

    public void setLeaseLifetime(Duration leaseLifetime) {
        this.leaseLifetime = leaseLifetime;
    }

    /**
     * Lease renewal period for a running job: a third of the lease lifetime.
     */
    public Duration leaseRenewalInterval() {
        return leaseLifetime.dividedBy(3);
    }

    public int getHandlerThreads() {
        return handlerThreads;
    }

    public void setHandlerThreads(int handlerThreads) {
        this.handlerThreads = handlerThreads;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getDefaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public void setDefaultMaxAttempts(int defaultMaxAttempts) {
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    public Duration getDefaultInitialDelay() {
        return defaultInitialDelay;
    }

    public void setDefaultInitialDelay(Duration defaultInitialDelay) {
        this.defaultInitialDelay = defaultInitialDelay;
    }

    public Duration getDefaultMaxDelay() {
        return defaultMaxDelay;
    }

    public void setDefaultMaxDelay(Duration defaultMaxDelay) {
        this.defaultMaxDelay = defaultMaxDelay;
    }

    public boolean isStartWorker() {
        return startWorker;
    }

    public void setStartWorker(boolean startWorker) {
        this.startWorker = startWorker;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
