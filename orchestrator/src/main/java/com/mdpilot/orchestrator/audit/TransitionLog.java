package com.mdpilot.orchestrator.audit;

/**
 * Append-only sink for the transitions of one pipeline run.
 *
 * Implementations must not throw: losing an audit record is logged,
 * it never fails the invocation that produced it.
 */
@FunctionalInterface
public interface TransitionLog {

    TransitionLog NONE = transition -> { };

    void append(Transition transition);
}
