package com.mdpilot.orchestrator.gate;

/**
 * State of a named pipeline precondition.
 *
 * Transitions:
 *   UNSET → OPEN | BLOCKED   (first declared side effect of an invocation)
 *   OPEN  → BLOCKED          (only by a capability that declares the gate as affected)
 *   BLOCKED → OPEN
 *
 * Nothing ever moves a gate back to UNSET.
 */
public enum GateState {
    UNSET,
    OPEN,
    BLOCKED
}
