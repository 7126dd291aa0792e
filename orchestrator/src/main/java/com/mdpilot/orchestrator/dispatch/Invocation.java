package com.mdpilot.orchestrator.dispatch;

import com.mdpilot.orchestrator.capability.GateUpdate;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One attempt to run a capability.
 *
 * Mutable while pending or running, and only through the owning
 * {@link Dispatcher}; once terminal every further transition is refused.
 */
class Invocation {

    private final long                id;
    private final String              capability;
    private final Map<String, Object> arguments;
    private final Instant             requestedAt;

    private InvocationStatus    status = InvocationStatus.PENDING;
    private FailureReason       reason;
    private String              detail = "";
    private Map<String, Object> result = Map.of();
    private List<GateUpdate>    gateUpdatesApplied = List.of();
    private List<String>        unmetGates = List.of();
    private String              jobId;
    private int                 resubmissions;
    private Instant             startedAt;
    private Instant             finishedAt;

    private final CompletableFuture<Outcome> completion = new CompletableFuture<>();

    Invocation(long id, String capability, Map<String, Object> arguments, Instant requestedAt) {
        this.id          = id;
        this.capability  = capability;
        this.arguments   = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.requestedAt = requestedAt;
    }

    long id()                       { return id; }
    String capability()             { return capability; }
    Map<String, Object> arguments() { return arguments; }
    CompletableFuture<Outcome> completion() { return completion; }

    synchronized InvocationStatus status() { return status; }
    synchronized boolean isTerminal()      { return status.isTerminal(); }
    synchronized Instant startedAt()       { return startedAt; }
    synchronized String jobId()            { return jobId; }
    synchronized int resubmissions()       { return resubmissions; }

    /** @return false if the invocation is no longer pending (cancelled meanwhile) */
    synchronized boolean start(Instant at) {
        if (status != InvocationStatus.PENDING) {
            return false;
        }
        status    = InvocationStatus.RUNNING;
        startedAt = at;
        return true;
    }

    synchronized void attachJob(String jobId) {
        this.jobId = jobId;
    }

    synchronized void recordResubmission() {
        resubmissions++;
    }

    synchronized void rejectFor(List<String> unmet) {
        this.unmetGates = List.copyOf(unmet);
    }

    /**
     * Move to a terminal status.
     *
     * @return false if the invocation was already terminal; nothing is changed then
     */
    synchronized boolean complete(InvocationStatus target, FailureReason failure, String message,
                                  Map<String, Object> payload, List<GateUpdate> applied, Instant at) {
        if (status.isTerminal()) {
            return false;
        }
        status             = target;
        reason             = failure;
        detail             = message == null ? "" : message;
        result             = payload == null ? Map.of() : payload;
        gateUpdatesApplied = List.copyOf(applied);
        finishedAt         = at;
        return true;
    }

    synchronized Outcome toOutcome() {
        return new Outcome(id, capability, arguments, status, reason, detail, result,
                gateUpdatesApplied, unmetGates, jobId, requestedAt, finishedAt);
    }
}
