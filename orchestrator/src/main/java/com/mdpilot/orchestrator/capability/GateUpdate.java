package com.mdpilot.orchestrator.capability;

import com.mdpilot.orchestrator.gate.GateState;

/**
 * A gate change an executor declares as the side effect of its invocation.
 * Only OPEN and BLOCKED are valid targets.
 */
public record GateUpdate(String gate, GateState state, String evidence) {

    public GateUpdate {
        if (gate == null || gate.isBlank()) {
            throw new IllegalArgumentException("Gate update must name a gate");
        }
        if (state != GateState.OPEN && state != GateState.BLOCKED) {
            throw new IllegalArgumentException("Gate '" + gate + "' can only be opened or blocked, not " + state);
        }
    }

    public static GateUpdate open(String gate, String evidence) {
        return new GateUpdate(gate, GateState.OPEN, evidence);
    }

    public static GateUpdate blocked(String gate, String evidence) {
        return new GateUpdate(gate, GateState.BLOCKED, evidence);
    }
}
