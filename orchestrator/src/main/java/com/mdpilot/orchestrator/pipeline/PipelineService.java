package com.mdpilot.orchestrator.pipeline;

import com.mdpilot.orchestrator.audit.AuditTrail;
import com.mdpilot.orchestrator.audit.TransitionLog;
import com.mdpilot.orchestrator.capability.CapabilityRegistry;
import com.mdpilot.orchestrator.config.OrchestratorProperties;
import com.mdpilot.orchestrator.dispatch.Dispatcher;
import com.mdpilot.orchestrator.dispatch.FailureReason;
import com.mdpilot.orchestrator.gate.GateLedger;
import com.mdpilot.orchestrator.job.BatchScheduler;
import com.mdpilot.orchestrator.job.JobLifecycleManager;
import com.mdpilot.orchestrator.job.JobPolicy;
import com.mdpilot.orchestrator.job.Sleeper;
import com.mdpilot.orchestrator.oracle.DecisionOracle;
import com.mdpilot.orchestrator.oracle.DecisionOracleFactory;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Starts and tracks pipeline runs.
 *
 * Each run gets its own gate ledger, job manager and dispatcher; the capability
 * registry and the batch scheduler are shared. Runs execute on a fixed worker
 * pool, so at most {@code mdpilot.workers} pipelines drive their oracle at once.
 */
@Service
@EnableScheduling
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final CapabilityRegistry       registry;
    private final OrchestrationLoop        loop;
    private final DecisionOracleFactory    oracleFactory;
    private final BatchScheduler           batchScheduler;
    private final ScheduledExecutorService jobPollExecutor;
    private final Executor                 jobCompletionExecutor;
    private final JobPolicy                jobPolicy;
    private final AuditTrail               auditTrail;
    private final MeterRegistry            meterRegistry;
    private final Clock                    clock;
    private final OrchestratorProperties   properties;

    private final ExecutorService          workers;
    private final Map<UUID, PipelineRun>   runs = new ConcurrentHashMap<>();

    public PipelineService(CapabilityRegistry registry,
                           OrchestrationLoop loop,
                           DecisionOracleFactory oracleFactory,
                           BatchScheduler batchScheduler,
                           ScheduledExecutorService jobPollExecutor,
                           @Qualifier("jobCompletionExecutor") Executor jobCompletionExecutor,
                           JobPolicy jobPolicy,
                           AuditTrail auditTrail,
                           MeterRegistry meterRegistry,
                           Clock clock,
                           OrchestratorProperties properties) {
        this.registry              = registry;
        this.loop                  = loop;
        this.oracleFactory         = oracleFactory;
        this.batchScheduler        = batchScheduler;
        this.jobPollExecutor       = jobPollExecutor;
        this.jobCompletionExecutor = jobCompletionExecutor;
        this.jobPolicy             = jobPolicy;
        this.auditTrail            = auditTrail;
        this.meterRegistry         = meterRegistry;
        this.clock                 = clock;
        this.properties            = properties;
        this.workers               = Executors.newFixedThreadPool(properties.getWorkers());
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /** Start a run driven by the configured oracle. */
    public PipelineRun start(String goal) {
        return start(goal, null);
    }

    /**
     * Start a run.
     *
     * @param oracle oracle to use; null for one from the configured factory
     */
    public PipelineRun start(String goal, DecisionOracle oracle) {
        PipelineRun run = newRun(goal);
        DecisionOracle decisions = oracle != null
                ? oracle
                : oracleFactory.create(run.id(), goal, run.operatorFeedback());
        runs.put(run.id(), run);
        log.info("Queued pipeline run {}: {}", run.id(), goal);

        workers.submit(() -> {
            try {
                loop.run(run, decisions);
            } catch (Exception e) {
                log.error("Unhandled error in pipeline run {}: {}", run.id(), e.getMessage(), e);
                run.dispatcher().cancelAll("Pipeline crashed: " + e.getMessage());
                run.finish(new PipelineResult(run.id(), PipelineSignal.PIPELINE_FAILED,
                        FailureReason.INTERNAL_ERROR, "Unhandled exception: " + e.getMessage(),
                        run.ledger().snapshot(), run.dispatcher().invocations(), run.ledger().history(),
                        0, run.startedAt(), clock.instant()));
            }
        });
        return run;
    }

    private PipelineRun newRun(String goal) {
        UUID id = UUID.randomUUID();
        TransitionLog transitionLog = auditTrail.forRun(id);
        GateLedger ledger = new GateLedger(registry.gateNames(), transitionLog, clock);
        JobLifecycleManager jobs = new JobLifecycleManager(batchScheduler, jobPollExecutor,
                jobCompletionExecutor, jobPolicy, transitionLog, meterRegistry, clock, Sleeper.SYSTEM);
        Dispatcher dispatcher = new Dispatcher(id, registry, ledger, jobs, transitionLog, meterRegistry, clock);
        return new PipelineRun(id, goal, ledger, dispatcher, jobs, clock.instant());
    }

    public Optional<PipelineRun> find(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /** All tracked runs, newest first. */
    public List<PipelineRun> runs() {
        return runs.values().stream()
                .sorted(Comparator.comparing(PipelineRun::startedAt).reversed())
                .toList();
    }

    /** @return false if the run is unknown */
    public boolean cancel(UUID runId, String reason) {
        PipelineRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        log.info("Cancel requested for run {}: {}", runId, reason);
        run.requestCancel(reason);
        return true;
    }

    /**
     * Queue an operator correction; the oracle sees it on its next turn.
     *
     * @return false if the run is unknown
     */
    public boolean addCorrection(UUID runId, String text) {
        PipelineRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        run.operatorFeedback().add(text);
        log.info("Operator correction queued for run {}: {}", runId, text);
        return true;
    }

    // ------------------------------------------------------------------
    // Housekeeping
    // ------------------------------------------------------------------

    /** Forget finished runs older than the retention period. Their audit trail stays in the database. */
    @Scheduled(fixedDelay = 600_000)
    public void evictFinishedRuns() {
        Instant cutoff = clock.instant().minus(properties.getRuns().getRetention());
        runs.values().removeIf(run -> run.result()
                .map(r -> r.finishedAt().isBefore(cutoff))
                .orElse(false));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down: cancelling {} active run(s)",
                runs.values().stream().filter(r -> !r.isFinished()).count());
        runs.values().stream()
                .filter(r -> !r.isFinished())
                .forEach(r -> r.requestCancel("Orchestrator shutting down"));
        workers.shutdown();
    }
}
