package com.mdpilot.orchestrator.pipeline;

import com.mdpilot.orchestrator.dispatch.Dispatcher;
import com.mdpilot.orchestrator.gate.GateLedger;
import com.mdpilot.orchestrator.job.JobLifecycleManager;

import java.time.Instant;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * One pipeline instance: its own gate ledger, dispatcher and job manager.
 *
 * The orchestration loop runs it on a worker thread; operators cancel it or
 * add corrections from request threads.
 */
public class PipelineRun {

    private final UUID                id;
    private final String              goal;
    private final GateLedger          ledger;
    private final Dispatcher          dispatcher;
    private final JobLifecycleManager jobs;
    private final Instant             startedAt;

    private final Queue<String> operatorFeedback = new ConcurrentLinkedQueue<>();

    private volatile String         cancelReason;
    private volatile PipelineResult result;

    public PipelineRun(UUID id, String goal, GateLedger ledger, Dispatcher dispatcher,
                       JobLifecycleManager jobs, Instant startedAt) {
        this.id         = id;
        this.goal       = goal;
        this.ledger     = ledger;
        this.dispatcher = dispatcher;
        this.jobs       = jobs;
        this.startedAt  = startedAt;
    }

    public UUID                id()         { return id; }
    public String              goal()       { return goal; }
    public GateLedger          ledger()     { return ledger; }
    public Dispatcher          dispatcher() { return dispatcher; }
    public JobLifecycleManager jobs()       { return jobs; }
    public Instant             startedAt()  { return startedAt; }

    public Queue<String> operatorFeedback() {
        return operatorFeedback;
    }

    /** Ask the loop to stop; it cancels outstanding work on its next turn. */
    public void requestCancel(String reason) {
        if (cancelReason == null) {
            cancelReason = reason == null || reason.isBlank() ? "Cancelled by operator" : reason;
        }
    }

    public boolean isCancelRequested() {
        return cancelReason != null;
    }

    public String cancelReason() {
        return cancelReason;
    }

    void finish(PipelineResult result) {
        this.result = result;
    }

    public Optional<PipelineResult> result() {
        return Optional.ofNullable(result);
    }

    public boolean isFinished() {
        return result != null;
    }
}
