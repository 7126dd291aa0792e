package com.mdpilot.orchestrator.executor;

/**
 * Thrown when the scientific tool service returns an error or is unreachable.
 */
public class ToolServiceException extends RuntimeException {

    public ToolServiceException(String message) {
        super(message);
    }

    public ToolServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
