package com.mdpilot.orchestrator.memory;

import com.mdpilot.orchestrator.gate.GateState;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Where a correction applies: the capability about to run and the gate states at that moment.
 */
public record CorrectionContext(String capability, Map<String, GateState> gates) {

    public CorrectionContext {
        gates = gates == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(gates));
    }

    /** Number of gates whose state is the same in both contexts. */
    public int sharedGateStates(CorrectionContext other) {
        return (int) gates.entrySet().stream()
                .filter(e -> e.getValue() == other.gates().get(e.getKey()))
                .count();
    }
}
