package com.mdpilot.orchestrator.audit;

import com.mdpilot.orchestrator.gate.GateTransition;

import java.time.Instant;

/**
 * One state change anywhere in a pipeline run.
 *
 * @param at           When the change happened.
 * @param invocationId Invocation the change belongs to (null for run-level events).
 * @param kind         Invocation, gate or job.
 * @param subject      Capability name, gate name or job id.
 * @param fromState    Previous state; null for the first record of a subject.
 * @param toState      New state.
 * @param detail       Evidence, failure reason or other free text.
 */
public record Transition(
        Instant        at,
        Long           invocationId,
        TransitionKind kind,
        String         subject,
        String         fromState,
        String         toState,
        String         detail) {

    public static Transition gate(GateTransition t) {
        return new Transition(t.at(), t.invocationId(), TransitionKind.GATE, t.gate(),
                t.from().name(), t.to().name(), t.evidence());
    }

    public static Transition invocation(Instant at, long invocationId, String capability,
                                        Enum<?> from, Enum<?> to, String detail) {
        return new Transition(at, invocationId, TransitionKind.INVOCATION, capability,
                from == null ? null : from.name(), to.name(), detail);
    }

    public static Transition job(Instant at, long invocationId, String jobId,
                                 Enum<?> from, Enum<?> to, String detail) {
        return new Transition(at, invocationId, TransitionKind.JOB, jobId,
                from == null ? null : from.name(), to.name(), detail);
    }
}
