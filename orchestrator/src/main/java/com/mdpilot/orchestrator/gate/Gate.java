package com.mdpilot.orchestrator.gate;

import java.time.Instant;

/**
 * Current value of one gate in the ledger.
 *
 * @param name         Gate name, e.g. "structure_validated".
 * @param state        Current state.
 * @param evidence     Why the gate is in this state (tool output, validation message).
 * @param updatedAt    When the state was last written.
 * @param invocationId Invocation that last changed the gate; null while UNSET.
 */
public record Gate(
        String    name,
        GateState state,
        String    evidence,
        Instant   updatedAt,
        Long      invocationId) {

    public static Gate unset(String name, Instant at) {
        return new Gate(name, GateState.UNSET, "Not evaluated yet", at, null);
    }

    public boolean isOpen() {
        return state == GateState.OPEN;
    }
}
