package com.mdpilot.orchestrator.oracle;

/**
 * The oracle could not produce a usable decision.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
