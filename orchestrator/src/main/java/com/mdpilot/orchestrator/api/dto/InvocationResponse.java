package com.mdpilot.orchestrator.api.dto;

import com.mdpilot.orchestrator.dispatch.InvocationStatus;
import com.mdpilot.orchestrator.dispatch.Outcome;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of an invocation returned by GET /pipelines/{id}/invocations.
 */
public record InvocationResponse(
        long                id,
        String              capability,
        Map<String, Object> arguments,
        InvocationStatus    status,
        String              reason,
        String              detail,
        List<String>        gatesChanged,
        List<String>        unmetGates,
        String              jobId,
        Instant             requestedAt,
        Instant             finishedAt
) {
    public static InvocationResponse from(Outcome o) {
        return new InvocationResponse(
                o.invocationId(),
                o.capability(),
                o.arguments(),
                o.status(),
                o.reason() == null ? null : o.reason().name(),
                o.detail(),
                o.gateUpdatesApplied().stream().map(u -> u.gate() + "=" + u.state()).toList(),
                o.unmetGates(),
                o.jobId(),
                o.requestedAt(),
                o.finishedAt()
        );
    }
}
