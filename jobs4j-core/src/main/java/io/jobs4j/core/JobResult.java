package io.jobs4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one execution attempt. Produced once, never mutated.
 *
 * @param success  whether the attempt succeeded
 * @param data     handler output on success, may be null
 * @param error    failure message, null on success
 * @param metadata free-form diagnostics, never null
 */
public record JobResult(
        boolean success,
        Object data,
        String error,
        Map<String, Object> metadata
) {

    public static final String FAILURE_KEY = "failure";
    public static final String TIMEOUT_ERROR = "timeout";

    public JobResult {
        metadata = (metadata == null || metadata.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Success without output.
     */
    public static JobResult ok() {
        return new JobResult(true, null, null, null);
    }

    public static JobResult success(Object data) {
        return new JobResult(true, data, null, null);
    }

    public static JobResult success(Object data, Map<String, Object> metadata) {
        return new JobResult(true, data, null, metadata);
    }

    public static JobResult failure(String error) {
        return new JobResult(false, null, error, null);
    }

    public static JobResult failure(String error, Map<String, Object> metadata) {
        return new JobResult(false, null, error, metadata);
    }

    static JobResult failure(FailureKind kind, String error) {
        return new JobResult(false, null, error, Map.of(FAILURE_KEY, kind.name()));
    }

    public static JobResult timeout() {
        return failure(FailureKind.TIMEOUT, TIMEOUT_ERROR);
    }

    public static JobResult fault(String error) {
        return failure(FailureKind.HANDLER_FAULT, error);
    }

    public static JobResult unknownJob(String jobId) {
        return failure(FailureKind.UNKNOWN_JOB, "No job registered for id: " + jobId);
    }

    public static JobResult invalidPayload(String error) {
        return failure(FailureKind.INVALID_PAYLOAD, error);
    }

    /**
     * @return the recorded failure kind, or {@link FailureKind#HANDLER_FAILURE} for a plain
     * failed result, or null on success
     */
    public FailureKind failureKind() {
        if (success) {
            return null;
        }
        Object kind = metadata.get(FAILURE_KEY);
        if (kind == null) {
            return FailureKind.HANDLER_FAILURE;
        }
        try {
            return FailureKind.valueOf(kind.toString());
        } catch (IllegalArgumentException e) {
            return FailureKind.HANDLER_FAILURE;
        }
    }

    /**
     * Failure message with a fallback for handlers that fail without one.
     */
    public String errorOrDefault() {
        return (error == null || error.isBlank()) ? "Unknown error" : error;
    }
}
