package com.mdpilot.orchestrator.dispatch;

import com.mdpilot.orchestrator.audit.Transition;
import com.mdpilot.orchestrator.audit.TransitionLog;
import com.mdpilot.orchestrator.capability.Capability;
import com.mdpilot.orchestrator.capability.CapabilityExecutor;
import com.mdpilot.orchestrator.capability.CapabilityRegistry;
import com.mdpilot.orchestrator.capability.ExecutionMode;
import com.mdpilot.orchestrator.capability.ExecutionResult;
import com.mdpilot.orchestrator.capability.GateUpdate;
import com.mdpilot.orchestrator.capability.InvocationContext;
import com.mdpilot.orchestrator.capability.JobBackedExecutor;
import com.mdpilot.orchestrator.gate.GateLedger;
import com.mdpilot.orchestrator.gate.GateState;
import com.mdpilot.orchestrator.job.BatchSchedulerException;
import com.mdpilot.orchestrator.job.Job;
import com.mdpilot.orchestrator.job.JobLifecycleManager;
import com.mdpilot.orchestrator.job.JobNotCompleteException;
import com.mdpilot.orchestrator.job.JobSpec;
import com.mdpilot.orchestrator.job.SubmissionException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single enforcement point between a proposed action and its execution.
 *
 * For every {@link #propose} call:
 * <ol>
 *   <li>An invocation id is assigned in arrival order and a PENDING record created.</li>
 *   <li>The capability is looked up and the arguments validated.</li>
 *   <li>Every required gate must be OPEN in the ledger.</li>
 *   <li>The capability's in-flight slot is reserved: at most one pending or
 *       running invocation per capability name, a second proposal is rejected
 *       immediately.</li>
 *   <li>Synchronous executors run on the caller's thread; job-backed ones are
 *       submitted to the job manager and complete when their job is terminal.</li>
 *   <li>Declared gate updates are applied and the outcome returned.</li>
 * </ol>
 *
 * Nothing thrown by an executor, the job manager or the batch scheduler escapes
 * this class: every failure becomes an {@link Outcome}.
 *
 * One dispatcher serves one pipeline run. It is safe for concurrent proposals.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final UUID                runId;
    private final CapabilityRegistry  registry;
    private final GateLedger          ledger;
    private final JobLifecycleManager jobs;
    private final TransitionLog       transitionLog;
    private final MeterRegistry       meterRegistry;
    private final Clock               clock;

    private final AtomicLong                   nextId      = new AtomicLong();
    private final Map<Long, Invocation>        invocations = new ConcurrentSkipListMap<>();
    private final Map<String, Invocation>      inFlight    = new ConcurrentHashMap<>();
    private volatile boolean                   cancelled;

    public Dispatcher(UUID runId,
                      CapabilityRegistry registry,
                      GateLedger ledger,
                      JobLifecycleManager jobs,
                      TransitionLog transitionLog,
                      MeterRegistry meterRegistry,
                      Clock clock) {
        this.runId         = runId;
        this.registry      = registry;
        this.ledger        = ledger;
        this.jobs          = jobs;
        this.transitionLog = transitionLog;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Propose
    // ------------------------------------------------------------------

    /**
     * Admit, run and record one capability invocation.
     *
     * @return a terminal outcome, or a RUNNING outcome for a submitted batch job
     */
    public Outcome propose(String capabilityName, Map<String, Object> args) {
        Map<String, Object> arguments = args == null ? Map.of() : args;
        Instant now = clock.instant();
        Invocation inv = new Invocation(nextId.incrementAndGet(), capabilityName, arguments, now);
        invocations.put(inv.id(), inv);
        transitionLog.append(Transition.invocation(now, inv.id(), capabilityName,
                null, InvocationStatus.PENDING, null));

        MDC.put("invocationId", String.valueOf(inv.id()));
        MDC.put("capability", String.valueOf(capabilityName));
        try {
            Optional<Capability> found = capabilityName == null ? Optional.empty() : registry.find(capabilityName);
            if (found.isEmpty()) {
                return reject(inv, FailureReason.UNKNOWN_CAPABILITY,
                        "Unknown capability '" + capabilityName + "'", List.of());
            }
            Capability capability = found.get();

            List<String> problems = ArgumentValidator.validate(capability, arguments);
            if (!problems.isEmpty()) {
                return reject(inv, FailureReason.INVALID_ARGUMENTS, String.join("; ", problems), List.of());
            }

            List<String> unmet = ledger.unmet(capability.requiredGates());
            if (!unmet.isEmpty()) {
                return reject(inv, FailureReason.GATE_NOT_OPEN,
                        "Required gates not open: " + String.join(", ", unmet), unmet);
            }

            if (cancelled) {
                return reject(inv, FailureReason.CANCELLED, "Pipeline run is cancelled", List.of());
            }

            Invocation holder = inFlight.putIfAbsent(capabilityName, inv);
            if (holder != null) {
                return reject(inv, FailureReason.ALREADY_IN_FLIGHT,
                        "Invocation #" + holder.id() + " of '" + capabilityName + "' is still " + holder.status(),
                        List.of());
            }
            if (cancelled) {
                inFlight.remove(capabilityName, inv);
                return reject(inv, FailureReason.CANCELLED, "Pipeline run is cancelled", List.of());
            }

            if (!inv.start(clock.instant())) {
                return settle(inv);
            }
            transitionLog.append(Transition.invocation(inv.startedAt(), inv.id(), capabilityName,
                    InvocationStatus.PENDING, InvocationStatus.RUNNING, null));
            log.info("Invocation #{} '{}' running with args {}", inv.id(), capabilityName, arguments);

            return capability.mode() == ExecutionMode.JOB
                    ? startJob(capability, inv)
                    : runSynchronously(capability, inv);
        } finally {
            MDC.remove("invocationId");
            MDC.remove("capability");
        }
    }

    private Outcome runSynchronously(Capability capability, Invocation inv) {
        CapabilityExecutor executor = registry.executorFor(capability.name());
        ExecutionResult result;
        try {
            result = executor.execute(capability, inv.arguments(), context(inv));
            if (result == null) {
                throw new IllegalStateException("executor returned no result");
            }
        } catch (Exception e) {
            log.error("Executor '{}' failed for invocation #{} '{}': {}",
                    executor.id(), inv.id(), capability.name(), e.getMessage(), e);
            return fail(capability, inv, FailureReason.EXECUTOR_FAULT,
                    "Executor '" + executor.id() + "' failed: " + e.getMessage());
        }
        return apply(capability, inv, result);
    }

    // ------------------------------------------------------------------
    // Job-backed invocations
    // ------------------------------------------------------------------

    private Outcome startJob(Capability capability, Invocation inv) {
        JobBackedExecutor executor = (JobBackedExecutor) registry.executorFor(capability.name());
        InvocationContext ctx = context(inv);
        JobSpec spec;
        try {
            spec = executor.prepareJob(capability, inv.arguments(), ctx);
            if (spec == null) {
                throw new IllegalStateException("executor prepared no job");
            }
        } catch (Exception e) {
            log.error("Executor '{}' could not prepare a job for invocation #{}: {}",
                    executor.id(), inv.id(), e.getMessage(), e);
            return fail(capability, inv, FailureReason.EXECUTOR_FAULT,
                    "Executor '" + executor.id() + "' failed: " + e.getMessage());
        }
        return submit(capability, inv, executor, spec, ctx);
    }

    private Outcome submit(Capability capability, Invocation inv, JobBackedExecutor executor,
                           JobSpec spec, InvocationContext ctx) {
        String jobId;
        try {
            jobId = jobs.submit(spec, inv.id());
        } catch (SubmissionException e) {
            log.error("Submission failed for invocation #{} '{}': {}", inv.id(), capability.name(), e.getMessage());
            return fail(capability, inv, FailureReason.SUBMISSION_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job manager refused invocation #{} '{}': {}", inv.id(), capability.name(), e.getMessage(), e);
            return fail(capability, inv, FailureReason.SUBMISSION_ERROR, e.getMessage());
        }

        synchronized (inv) {
            if (inv.isTerminal()) {
                log.info("Invocation #{} ended while its job {} was being submitted; cancelling the job",
                        inv.id(), jobId);
                jobs.cancel(jobId);
                return inv.toOutcome();
            }
            inv.attachJob(jobId);
        }

        jobs.completion(jobId).whenComplete((job, error) ->
                onJobTerminal(capability, inv, executor, spec, ctx, job, error));
        return inv.toOutcome();
    }

    private void onJobTerminal(Capability capability, Invocation inv, JobBackedExecutor executor,
                               JobSpec spec, InvocationContext ctx, Job job, Throwable error) {
        MDC.put("runId", runId.toString());
        MDC.put("invocationId", String.valueOf(inv.id()));
        MDC.put("capability", capability.name());
        try {
            if (error != null) {
                fail(capability, inv, FailureReason.EXECUTOR_FAULT, "Job tracking failed: " + error.getMessage());
                return;
            }
            switch (job.getState()) {
                case COMPLETED -> completeFromJob(capability, inv, executor, ctx, job);
                case FAILED -> {
                    if (!cancelled && jobs.policy().mayResubmit(spec.jobType(), inv.resubmissions())) {
                        inv.recordResubmission();
                        log.warn("Job {} of invocation #{} failed ({}); resubmitting ({}/{})",
                                job.getId(), inv.id(), job.getFailureReason(),
                                inv.resubmissions(), jobs.policy().maxResubmissions());
                        submit(capability, inv, executor, spec, ctx);
                    } else {
                        fail(capability, inv, FailureReason.JOB_FAILED,
                                "Job " + job.getId() + " failed: " + job.getFailureReason());
                    }
                }
                case TIMED_OUT -> fail(capability, inv, FailureReason.JOB_TIMEOUT,
                        "Job " + job.getId() + " timed out: " + job.getFailureReason());
                case CANCELLED -> fail(capability, inv, FailureReason.CANCELLED,
                        "Job " + job.getId() + " was cancelled");
                default -> fail(capability, inv, FailureReason.EXECUTOR_FAULT,
                        "Job " + job.getId() + " reported done in state " + job.getState());
            }
        } catch (Exception e) {
            log.error("Unhandled error finishing invocation #{}: {}", inv.id(), e.getMessage(), e);
            fail(capability, inv, FailureReason.EXECUTOR_FAULT, "Unhandled error: " + e.getMessage());
        } finally {
            MDC.remove("runId");
            MDC.remove("invocationId");
            MDC.remove("capability");
        }
    }

    private void completeFromJob(Capability capability, Invocation inv, JobBackedExecutor executor,
                                 InvocationContext ctx, Job job) {
        Map<String, Object> output;
        try {
            output = jobs.fetchResult(job.getId());
        } catch (BatchSchedulerException | JobNotCompleteException e) {
            log.error("Could not fetch result of job {}: {}", job.getId(), e.getMessage());
            fail(capability, inv, FailureReason.JOB_FAILED,
                    "Result of job " + job.getId() + " unavailable: " + e.getMessage());
            return;
        }
        ExecutionResult result;
        try {
            result = executor.interpretResult(capability, inv.arguments(), output, ctx);
            if (result == null) {
                throw new IllegalStateException("executor returned no result");
            }
        } catch (Exception e) {
            log.error("Executor '{}' could not interpret job {}: {}", executor.id(), job.getId(), e.getMessage(), e);
            fail(capability, inv, FailureReason.EXECUTOR_FAULT,
                    "Executor '" + executor.id() + "' failed: " + e.getMessage());
            return;
        }
        apply(capability, inv, result);
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    /** Apply an executor's verdict and gate updates; a late result for a terminal invocation is discarded. */
    private Outcome apply(Capability capability, Invocation inv, ExecutionResult result) {
        synchronized (inv) {
            if (inv.isTerminal()) {
                log.warn("Discarding result of invocation #{} '{}': already {}",
                        inv.id(), capability.name(), inv.status());
                return inv.toOutcome();
            }
            List<GateUpdate> applied = new ArrayList<>();
            for (GateUpdate update : result.gateUpdates()) {
                if (!capability.affects(update.gate())) {
                    log.warn("Dropping update of undeclared gate '{}' from '{}' (declared: {})",
                            update.gate(), capability.name(), capability.affectedGates());
                    continue;
                }
                if (update.state() == GateState.OPEN) {
                    ledger.open(update.gate(), update.evidence(), inv.id());
                } else {
                    ledger.block(update.gate(), update.evidence(), inv.id());
                }
                applied.add(update);
            }
            if (result.success()) {
                terminate(capability, inv, InvocationStatus.SUCCEEDED, null,
                        result.message(), result.result(), applied);
            } else {
                terminate(capability, inv, InvocationStatus.FAILED, FailureReason.DOMAIN_FAILURE,
                        result.message(), result.result(), applied);
            }
        }
        return settle(inv);
    }

    private Outcome fail(Capability capability, Invocation inv, FailureReason reason, String detail) {
        synchronized (inv) {
            if (inv.isTerminal()) {
                return inv.toOutcome();
            }
            terminate(capability, inv, InvocationStatus.FAILED, reason, detail, Map.of(), List.of());
        }
        return settle(inv);
    }

    private Outcome reject(Invocation inv, FailureReason reason, String detail, List<String> unmet) {
        synchronized (inv) {
            inv.rejectFor(unmet);
            if (inv.complete(InvocationStatus.REJECTED, reason, detail, Map.of(), List.of(), clock.instant())) {
                log.info("Rejected invocation #{} '{}': {} ({})", inv.id(), inv.capability(), reason, detail);
                transitionLog.append(Transition.invocation(clock.instant(), inv.id(), inv.capability(),
                        InvocationStatus.PENDING, InvocationStatus.REJECTED, reason + ": " + detail));
                meterRegistry.counter("mdpilot.invocation.calls",
                        "capability", String.valueOf(inv.capability()), "status", "rejected").increment();
            }
        }
        return settle(inv);
    }

    /** Caller holds the invocation's monitor. */
    private void terminate(Capability capability, Invocation inv, InvocationStatus status, FailureReason reason,
                           String detail, Map<String, Object> result, List<GateUpdate> applied) {
        Instant now = clock.instant();
        InvocationStatus from = inv.status();
        if (!inv.complete(status, reason, detail, result, applied, now)) {
            return;
        }
        if (status == InvocationStatus.SUCCEEDED) {
            log.info("Invocation #{} '{}' succeeded: {}", inv.id(), capability.name(), detail);
        } else {
            log.warn("Invocation #{} '{}' failed ({}): {}", inv.id(), capability.name(), reason, detail);
        }
        transitionLog.append(Transition.invocation(now, inv.id(), capability.name(), from, status,
                reason == null ? detail : reason + ": " + detail));
        meterRegistry.counter("mdpilot.invocation.calls",
                "capability", capability.name(), "status", status.name().toLowerCase()).increment();
        if (inv.startedAt() != null) {
            meterRegistry.timer("mdpilot.invocation.duration",
                    "capability", capability.name(), "mode", capability.mode().name().toLowerCase())
                    .record(Duration.between(inv.startedAt(), now));
        }
    }

    /** Release the in-flight slot and wake waiters. Called without the invocation's monitor. */
    private Outcome settle(Invocation inv) {
        Outcome outcome = inv.toOutcome();
        if (outcome.isTerminal()) {
            if (inv.capability() != null) {
                inFlight.remove(inv.capability(), inv);
            }
            inv.completion().complete(outcome);
        }
        return outcome;
    }

    private InvocationContext context(Invocation inv) {
        return new InvocationContext(runId, inv.id(), inv.capability(), ledger.states());
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Cancel the run: refuse new proposals, mark every pending or running
     * invocation FAILED/CANCELLED, then cancel outstanding jobs. Succeeded
     * invocations and their gate effects stay as they are.
     */
    public void cancelAll(String reason) {
        cancelled = true;
        for (Invocation inv : invocations.values()) {
            if (inv.isTerminal()) {
                continue;
            }
            Capability capability = registry.find(inv.capability()).orElse(null);
            if (capability == null) {
                continue;
            }
            fail(capability, inv, FailureReason.CANCELLED, reason);
        }
        jobs.cancelAll();
        log.info("Cancelled run {}: {}", runId, reason);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Completes with the terminal outcome of an invocation. */
    public CompletableFuture<Outcome> awaitOutcome(long invocationId) {
        Invocation inv = invocations.get(invocationId);
        if (inv == null) {
            throw new IllegalArgumentException("Unknown invocation: " + invocationId);
        }
        return inv.completion().copy();
    }

    public Optional<Outcome> invocation(long invocationId) {
        return Optional.ofNullable(invocations.get(invocationId)).map(Invocation::toOutcome);
    }

    /** Every invocation of the run, ordered by id. */
    public List<Outcome> invocations() {
        return invocations.values().stream().map(Invocation::toOutcome).toList();
    }

    /** Invocations still pending or running, ordered by id. */
    public List<Outcome> inFlight() {
        return invocations.values().stream()
                .map(Invocation::toOutcome)
                .filter(o -> !o.isTerminal())
                .toList();
    }

    public UUID runId() {
        return runId;
    }
}
