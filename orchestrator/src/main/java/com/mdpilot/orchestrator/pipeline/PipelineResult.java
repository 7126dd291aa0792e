package com.mdpilot.orchestrator.pipeline;

import com.mdpilot.orchestrator.dispatch.FailureReason;
import com.mdpilot.orchestrator.dispatch.Outcome;
import com.mdpilot.orchestrator.gate.Gate;
import com.mdpilot.orchestrator.gate.GateTransition;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Final state of a pipeline run.
 *
 * @param runId       Pipeline run.
 * @param signal      Complete, failed or cancelled.
 * @param reason      Why it failed or was cancelled; null when complete.
 * @param message     Human-readable summary of what ended the run.
 * @param gates       Gate ledger at the end of the run.
 * @param invocations Every invocation, ordered by id.
 * @param evidence    Every gate transition, in write order.
 * @param proposals   Proposals the oracle made.
 * @param startedAt   Run start.
 * @param finishedAt  Run end.
 */
public record PipelineResult(
        UUID                 runId,
        PipelineSignal       signal,
        FailureReason        reason,
        String               message,
        Map<String, Gate>    gates,
        List<Outcome>        invocations,
        List<GateTransition> evidence,
        int                  proposals,
        Instant              startedAt,
        Instant              finishedAt) {

    public boolean isComplete() {
        return signal == PipelineSignal.PIPELINE_COMPLETE;
    }

    /** Multi-line account of the run: the verdict, then every gate transition that led there. */
    public String evidenceTrail() {
        StringBuilder sb = new StringBuilder()
                .append(signal).append(reason == null ? "" : " (" + reason + ")")
                .append(": ").append(message).append('\n');
        for (GateTransition t : evidence) {
            sb.append("  ").append(t.at()).append(" #").append(t.invocationId()).append(' ')
              .append(t.gate()).append(' ').append(t.from()).append(" -> ").append(t.to());
            if (!t.evidence().isBlank()) {
                sb.append(": ").append(t.evidence());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
