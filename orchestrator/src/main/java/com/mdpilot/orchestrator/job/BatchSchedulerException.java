package com.mdpilot.orchestrator.job;

/**
 * Thrown when the batch scheduler cannot be reached or refuses a request.
 *
 * {@code transient} failures (I/O errors, HTTP 429/5xx) are retried by the
 * job manager; permanent ones (bad request, unknown handle) are not.
 */
public class BatchSchedulerException extends RuntimeException {

    private final boolean transientFailure;

    public BatchSchedulerException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public BatchSchedulerException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() { return transientFailure; }
}
