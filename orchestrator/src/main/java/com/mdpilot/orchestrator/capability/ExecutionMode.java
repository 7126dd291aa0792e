package com.mdpilot.orchestrator.capability;

/**
 * How a capability's executor returns its result.
 *
 * SYNCHRONOUS  execute() runs on the dispatching thread and returns the
 *              outcome directly. Used for structure preparation, validation,
 *              analysis and in-JVM status checks.
 *
 * JOB          the executor turns the arguments into a batch job; the
 *              invocation stays RUNNING until the job manager sees the job
 *              finish. Used for simulations submitted to the HPC scheduler.
 */
public enum ExecutionMode {
    SYNCHRONOUS,
    JOB
}
