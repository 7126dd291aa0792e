package com.mdpilot.orchestrator.dispatch;

/**
 * Why an invocation was rejected, failed, or why a pipeline run ended badly.
 */
public enum FailureReason {

    // Rejections: the invocation never ran; the oracle can react and try something else.
    UNKNOWN_CAPABILITY,
    DUPLICATE_CAPABILITY,
    INVALID_ARGUMENTS,
    GATE_NOT_OPEN,
    ALREADY_IN_FLIGHT,

    // Failures of an invocation that ran.
    EXECUTOR_FAULT,
    DOMAIN_FAILURE,
    SUBMISSION_ERROR,
    JOB_FAILED,
    JOB_TIMEOUT,
    JOB_NOT_COMPLETE,
    CANCELLED,

    // Run-level.
    MAX_INVOCATIONS_EXCEEDED,
    ORACLE_ERROR,
    INTERNAL_ERROR
}
