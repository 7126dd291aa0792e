package com.mdpilot.orchestrator.dispatch;

import com.mdpilot.orchestrator.capability.GateUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Structured result of {@link Dispatcher#propose}, and the immutable view of
 * an invocation at one point in time.
 *
 * A job-backed invocation first yields a RUNNING outcome carrying its job id;
 * the terminal outcome is available from {@link Dispatcher#awaitOutcome}.
 *
 * @param invocationId       Id assigned on arrival; strictly increasing per run.
 * @param capability         Proposed capability name (may be unknown).
 * @param arguments          Arguments as proposed.
 * @param status             RUNNING, SUCCEEDED, FAILED or REJECTED (PENDING only in live listings).
 * @param reason             Set for FAILED and REJECTED.
 * @param detail             Human-readable message: executor message, unmet gates, fault text.
 * @param result             Executor payload for SUCCEEDED and domain-FAILED invocations.
 * @param gateUpdatesApplied Gate updates written to the ledger.
 * @param unmetGates         Required gates that were not open (GATE_NOT_OPEN only).
 * @param jobId              Current or last job of a job-backed invocation.
 * @param requestedAt        When propose was called.
 * @param finishedAt         When the invocation became terminal; null while in flight.
 */
public record Outcome(
        long                invocationId,
        String              capability,
        Map<String, Object> arguments,
        InvocationStatus    status,
        FailureReason       reason,
        String              detail,
        Map<String, Object> result,
        List<GateUpdate>    gateUpdatesApplied,
        List<String>        unmetGates,
        String              jobId,
        Instant             requestedAt,
        Instant             finishedAt) {

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean succeeded() {
        return status == InvocationStatus.SUCCEEDED;
    }

    public boolean isRejection() {
        return status == InvocationStatus.REJECTED;
    }

    /** One-line summary fed back to the oracle. */
    public String toObservation() {
        StringBuilder sb = new StringBuilder()
                .append('#').append(invocationId).append(' ')
                .append(capability).append(": ").append(status);
        if (reason != null) {
            sb.append(" (").append(reason).append(')');
        }
        if (jobId != null && !isTerminal()) {
            sb.append(" job ").append(jobId);
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(" - ").append(detail);
        }
        if (!gateUpdatesApplied.isEmpty()) {
            sb.append(" gates: ");
            gateUpdatesApplied.forEach(u -> sb.append(u.gate()).append('=').append(u.state()).append(' '));
            sb.setLength(sb.length() - 1);
        }
        if (!result.isEmpty()) {
            sb.append(" result: ").append(result);
        }
        return sb.toString();
    }
}
