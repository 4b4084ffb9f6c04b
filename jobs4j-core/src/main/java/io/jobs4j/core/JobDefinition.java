package io.jobs4j.core;

import io.jobs4j.utils.CronSchedules;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable catalog entry for one job kind. Built at start-up, never mutated.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobDefinition<CampaignPayload> def = JobDefinition.builder("process-campaign-data", CampaignPayload.class)
 *         .name("Process Campaign Data")
 *         .timeout(Duration.ofMinutes(1))
 *         .retryPolicy(RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(30)))
 *         .build();
 * }</pre>
 */
public record JobDefinition<T>(
        String id,
        String name,
        String description,
        String schedule,
        RetryPolicy retryPolicy,
        Duration timeout,
        Priority priority,
        Class<T> payloadType,
        PayloadValidator<T> payloadValidator
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public JobDefinition {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(payloadType, "payloadType must not be null");
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (schedule != null && schedule.isBlank()) {
            schedule = null;
        }
        if (schedule != null && !CronSchedules.isValid(schedule)) {
            throw new IllegalArgumentException("Invalid cron schedule for job " + id + ": " + schedule);
        }
        if (payloadValidator == null) {
            payloadValidator = PayloadValidator.none();
        }
    }

    /**
     * A zero or negative timeout means the scheduler waits for the handler indefinitely.
     */
    public boolean hasTimeout() {
        return !timeout.isZero() && !timeout.isNegative();
    }

    public boolean isScheduled() {
        return schedule != null;
    }

    public static Builder<Object> builder(String id) {
        return new Builder<>(id, Object.class);
    }

    public static <T> Builder<T> builder(String id, Class<T> payloadType) {
        return new Builder<>(id, payloadType);
    }

    public static final class Builder<T> {
        private final String id;
        private final Class<T> payloadType;
        private String name;
        private String description;
        private String schedule;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration timeout = DEFAULT_TIMEOUT;
        private Priority priority = Priority.NORMAL;
        private PayloadValidator<T> payloadValidator;

        private Builder(String id, Class<T> payloadType) {
            this.id = id;
            this.payloadType = payloadType;
        }

        public Builder<T> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<T> description(String description) {
            this.description = description;
            return this;
        }

        /**
         * Cron expression evaluated by an external trigger (5 or 6 fields).
         */
        public Builder<T> schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder<T> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder<T> timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder<T> noTimeout() {
            this.timeout = Duration.ZERO;
            return this;
        }

        public Builder<T> priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder<T> validator(PayloadValidator<T> payloadValidator) {
            this.payloadValidator = payloadValidator;
            return this;
        }

        public JobDefinition<T> build() {
            return new JobDefinition<>(
                    id,
                    name,
                    description,
                    schedule,
                    retryPolicy,
                    timeout,
                    priority,
                    payloadType,
                    payloadValidator
            );
        }
    }
}
