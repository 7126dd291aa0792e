package com.mdpilot.orchestrator.api.dto;

import com.mdpilot.orchestrator.gate.Gate;
import com.mdpilot.orchestrator.gate.GateState;

import java.time.Instant;

/** One gate, as returned by GET /pipelines/{id}/gates. */
public record GateResponse(
        String    name,
        GateState state,
        String    evidence,
        Instant   updatedAt,
        Long      invocationId
) {
    public static GateResponse from(Gate g) {
        return new GateResponse(g.name(), g.state(), g.evidence(), g.updatedAt(), g.invocationId());
    }
}
