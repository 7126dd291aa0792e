package com.mdpilot.orchestrator.audit;

/** What a {@link Transition} record describes. */
public enum TransitionKind {
    INVOCATION,
    GATE,
    JOB
}
