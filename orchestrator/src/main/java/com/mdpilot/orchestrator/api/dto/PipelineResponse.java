package com.mdpilot.orchestrator.api.dto;

import com.mdpilot.orchestrator.pipeline.PipelineResult;
import com.mdpilot.orchestrator.pipeline.PipelineRun;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /pipelines and GET /pipelines/{id}.
 *
 * status is RUNNING until the run ends, then the pipeline signal
 * (PIPELINE_COMPLETE, PIPELINE_FAILED or PIPELINE_CANCELLED).
 */
public record PipelineResponse(
        UUID    id,
        String  goal,
        String  status,
        String  reason,
        String  message,
        int     invocations,
        long    openGates,
        int     totalGates,
        Instant startedAt,
        Instant finishedAt
) {
    public static PipelineResponse from(PipelineRun run) {
        PipelineResult result = run.result().orElse(null);
        var gates = run.ledger().snapshot();
        return new PipelineResponse(
                run.id(),
                run.goal(),
                result == null ? "RUNNING" : result.signal().name(),
                result == null || result.reason() == null ? null : result.reason().name(),
                result == null ? null : result.message(),
                run.dispatcher().invocations().size(),
                gates.values().stream().filter(g -> g.isOpen()).count(),
                gates.size(),
                run.startedAt(),
                result == null ? null : result.finishedAt()
        );
    }
}
