package com.mdpilot.orchestrator.pipeline;

import com.mdpilot.orchestrator.capability.Capability;
import com.mdpilot.orchestrator.capability.CapabilityRegistry;
import com.mdpilot.orchestrator.config.OrchestratorProperties;
import com.mdpilot.orchestrator.dispatch.Dispatcher;
import com.mdpilot.orchestrator.dispatch.FailureReason;
import com.mdpilot.orchestrator.dispatch.Outcome;
import com.mdpilot.orchestrator.memory.Correction;
import com.mdpilot.orchestrator.memory.CorrectionContext;
import com.mdpilot.orchestrator.memory.CorrectiveMemory;
import com.mdpilot.orchestrator.oracle.Decision;
import com.mdpilot.orchestrator.oracle.DecisionOracle;
import com.mdpilot.orchestrator.oracle.PipelineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The top-level driver of one pipeline run.
 *
 * Each turn:
 *   1. Stop if the run was cancelled.
 *   2. Collect outcomes of asynchronous invocations that finished since the last turn;
 *      a JOB_FAILED among them ends the run.
 *   3. Ask the oracle for the next decision, handing it the gate ledger, the
 *      invocation history and the new observations.
 *   4. PROPOSE: for a correction-sensitive capability, recall prior corrections
 *      and, if there are new ones, ask the oracle again with them in view.
 *      Then dispatch, and store the correction if the proposal was human-corrected.
 *      AWAIT: block until an outstanding invocation finishes.
 *      DONE: wait for outstanding invocations and finish.
 *
 * Rejections are never fatal here: they go back to the oracle as observations.
 * The run fails only on an unrecoverable job failure, an exhausted proposal
 * budget or an oracle error.
 */
@Component
public class OrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoop.class);

    // Waits are sliced so a cancel request is noticed while a job runs.
    private static final long WAIT_SLICE_MS = 500;

    private final CapabilityRegistry registry;
    private final CorrectiveMemory   memory;
    private final Clock              clock;
    private final int                maxInvocations;

    @Autowired
    public OrchestrationLoop(CapabilityRegistry registry,
                             CorrectiveMemory memory,
                             Clock clock,
                             OrchestratorProperties properties) {
        this(registry, memory, clock, properties.getMaxInvocations());
    }

    public OrchestrationLoop(CapabilityRegistry registry, CorrectiveMemory memory, Clock clock, int maxInvocations) {
        this.registry       = registry;
        this.memory         = memory;
        this.clock          = clock;
        this.maxInvocations = maxInvocations;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Drive a run to a terminal signal. Blocks the calling thread for the whole run.
     */
    public PipelineResult run(PipelineRun run, DecisionOracle oracle) {
        MDC.put("runId", run.id().toString());
        try {
            log.info("Starting pipeline run {}: {}", run.id(), run.goal());
            PipelineResult result = drive(run, oracle);
            log.info("Pipeline run {} ended {}{}: {}", run.id(), result.signal(),
                    result.reason() == null ? "" : " (" + result.reason() + ")", result.message());
            run.finish(result);
            return result;
        } finally {
            MDC.clear();
        }
    }

    private PipelineResult drive(PipelineRun run, DecisionOracle oracle) {
        Dispatcher dispatcher = run.dispatcher();
        Turns turns = new Turns();

        while (true) {
            if (run.isCancelRequested()) {
                return cancelled(run, turns);
            }

            collectFinished(dispatcher, turns);
            Optional<Outcome> jobFailure = firstJobFailure(turns.unseen);
            if (jobFailure.isPresent()) {
                return failed(run, turns, FailureReason.JOB_FAILED, jobFailure.get().toObservation());
            }

            Decision decision;
            try {
                decision = oracle.proposeNext(snapshot(run, turns, List.of()));
                turns.unseen.clear();
                if (decision.kind() == Decision.Kind.PROPOSE) {
                    decision = consultCorrections(run, oracle, turns, decision);
                }
            } catch (Exception e) {
                log.error("Oracle failed in run {}: {}", run.id(), e.getMessage(), e);
                return failed(run, turns, FailureReason.ORACLE_ERROR, "Oracle error: " + e.getMessage());
            }

            switch (decision.kind()) {
                case DONE -> {
                    return finish(run, turns);
                }
                case AWAIT -> {
                    if (dispatcher.inFlight().isEmpty()) {
                        // Waiting with nothing outstanding still uses up a turn of the budget.
                        if (turns.proposals >= maxInvocations) {
                            return budgetExhausted(run, turns);
                        }
                        turns.proposals++;
                    } else {
                        awaitAny(run);
                    }
                }
                case PROPOSE -> {
                    if (turns.proposals >= maxInvocations) {
                        return budgetExhausted(run, turns);
                    }
                    turns.proposals++;
                    dispatch(run, turns, decision);
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // Proposals
    // ------------------------------------------------------------------

    private void dispatch(PipelineRun run, Turns turns, Decision decision) {
        CorrectionContext context = new CorrectionContext(decision.capability(), run.ledger().states());
        Outcome outcome = run.dispatcher().propose(decision.capability(), decision.args());
        turns.unseen.add(outcome);
        if (outcome.isTerminal()) {
            turns.reported.add(outcome.invocationId());
        }

        if (decision.isHumanCorrected()) {
            try {
                memory.store(new Correction(decision.humanCorrection(), context, clock.instant()));
            } catch (Exception e) {
                log.warn("Could not store correction for '{}': {}", decision.capability(), e.getMessage());
            }
        }
    }

    /**
     * Before a correction-sensitive capability runs, show the oracle any
     * recalled corrections it has not seen yet and let it revise the proposal.
     */
    private Decision consultCorrections(PipelineRun run, DecisionOracle oracle, Turns turns, Decision decision) {
        Optional<Capability> capability = registry.find(decision.capability());
        if (capability.isEmpty() || !capability.get().correctionSensitive()) {
            return decision;
        }

        List<Correction> recalled;
        try {
            recalled = memory.recall(new CorrectionContext(decision.capability(), run.ledger().states()));
        } catch (Exception e) {
            log.warn("Corrective memory recall failed for '{}': {}", decision.capability(), e.getMessage());
            return decision;
        }
        List<Correction> fresh = recalled.stream().filter(turns.shownCorrections::add).toList();
        if (fresh.isEmpty()) {
            return decision;
        }

        log.info("Injecting {} prior correction(s) before '{}'", fresh.size(), decision.capability());
        Decision revised = oracle.proposeNext(snapshot(run, turns, fresh));
        return decision.isHumanCorrected() && !revised.isHumanCorrected()
                ? revised.withHumanCorrection(decision.humanCorrection())
                : revised;
    }

    // ------------------------------------------------------------------
    // Waiting
    // ------------------------------------------------------------------

    /** Block until one outstanding invocation finishes or the run is cancelled. */
    private void awaitAny(PipelineRun run) {
        Dispatcher dispatcher = run.dispatcher();
        CompletableFuture<?>[] pending = dispatcher.inFlight().stream()
                .map(o -> dispatcher.awaitOutcome(o.invocationId()))
                .toArray(CompletableFuture<?>[]::new);
        if (pending.length == 0) {
            return;
        }
        CompletableFuture<Object> any = CompletableFuture.anyOf(pending);
        while (!run.isCancelRequested()) {
            try {
                any.get(WAIT_SLICE_MS, TimeUnit.MILLISECONDS);
                return;
            } catch (TimeoutException e) {
                // slice elapsed; check for cancellation and keep waiting
                log.trace("Still waiting on {} invocation(s)", pending.length);
            } catch (ExecutionException e) {
                log.warn("Invocation completion failed: {}", e.getMessage());
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.requestCancel("Worker interrupted");
                return;
            }
        }
    }

    private void awaitAll(PipelineRun run) {
        while (!run.dispatcher().inFlight().isEmpty() && !run.isCancelRequested()) {
            awaitAny(run);
        }
    }

    // ------------------------------------------------------------------
    // Observations
    // ------------------------------------------------------------------

    private static void collectFinished(Dispatcher dispatcher, Turns turns) {
        for (Outcome outcome : dispatcher.invocations()) {
            if (outcome.isTerminal() && turns.reported.add(outcome.invocationId())) {
                turns.unseen.removeIf(o -> o.invocationId() == outcome.invocationId());
                turns.unseen.add(outcome);
            }
        }
    }

    private static Optional<Outcome> firstJobFailure(List<Outcome> outcomes) {
        return outcomes.stream()
                .filter(o -> o.reason() == FailureReason.JOB_FAILED)
                .findFirst();
    }

    private PipelineSnapshot snapshot(PipelineRun run, Turns turns, List<Correction> corrections) {
        return new PipelineSnapshot(run.id(), run.goal(), run.ledger().snapshot(),
                run.dispatcher().invocations(), turns.unseen, corrections,
                registry.describeCapabilities(), turns.proposals, maxInvocations);
    }

    // ------------------------------------------------------------------
    // Endings
    // ------------------------------------------------------------------

    private PipelineResult finish(PipelineRun run, Turns turns) {
        awaitAll(run);
        if (run.isCancelRequested()) {
            return cancelled(run, turns);
        }
        collectFinished(run.dispatcher(), turns);
        Optional<Outcome> jobFailure = firstJobFailure(turns.unseen);
        if (jobFailure.isPresent()) {
            return failed(run, turns, FailureReason.JOB_FAILED, jobFailure.get().toObservation());
        }
        return result(run, turns, PipelineSignal.PIPELINE_COMPLETE, null,
                "Oracle declared the pipeline done after " + turns.proposals + " proposal(s)");
    }

    private PipelineResult budgetExhausted(PipelineRun run, Turns turns) {
        return failed(run, turns, FailureReason.MAX_INVOCATIONS_EXCEEDED,
                "Proposal budget of " + maxInvocations + " exhausted");
    }

    private PipelineResult failed(PipelineRun run, Turns turns, FailureReason reason, String message) {
        if (!run.dispatcher().inFlight().isEmpty()) {
            run.dispatcher().cancelAll("Pipeline failed: " + reason);
        }
        return result(run, turns, PipelineSignal.PIPELINE_FAILED, reason, message);
    }

    private PipelineResult cancelled(PipelineRun run, Turns turns) {
        run.dispatcher().cancelAll(run.cancelReason());
        return result(run, turns, PipelineSignal.PIPELINE_CANCELLED, FailureReason.CANCELLED, run.cancelReason());
    }

    private PipelineResult result(PipelineRun run, Turns turns, PipelineSignal signal,
                                  FailureReason reason, String message) {
        return new PipelineResult(run.id(), signal, reason, message,
                run.ledger().snapshot(), run.dispatcher().invocations(), run.ledger().history(),
                turns.proposals, run.startedAt(), clock.instant());
    }

    /** Per-run bookkeeping of the loop. */
    private static final class Turns {
        int proposals;
        final List<Outcome>   unseen           = new ArrayList<>();
        final Set<Long>       reported         = new HashSet<>();
        final Set<Correction> shownCorrections = new HashSet<>();
    }
}
