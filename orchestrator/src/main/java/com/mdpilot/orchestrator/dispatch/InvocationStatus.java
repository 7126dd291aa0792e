package com.mdpilot.orchestrator.dispatch;

/**
 * Lifecycle of one invocation.
 *
 * Transitions:
 *   PENDING → REJECTED                   (unknown, invalid, gate closed, already in flight)
 *   PENDING → RUNNING → SUCCEEDED | FAILED
 *   PENDING | RUNNING → FAILED           (run cancelled)
 */
public enum InvocationStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    REJECTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == REJECTED;
    }
}
