package com.mdpilot.orchestrator.job;

/**
 * A job could not be submitted; no job record was created.
 */
public class SubmissionException extends RuntimeException {
    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
