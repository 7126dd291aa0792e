package com.mdpilot.orchestrator.job;

import com.mdpilot.orchestrator.audit.Transition;
import com.mdpilot.orchestrator.audit.TransitionLog;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Owns the batch jobs of one pipeline run: submit, poll, cancel, fetch results.
 *
 * Polling is driven by a shared {@link ScheduledExecutorService}. Each job has at
 * most one queued poll: every poll, scheduled or called directly, replaces it
 * with one at {@code nextPollAt} until the job is terminal.
 * The interval starts at the policy minimum, doubles while the scheduler keeps
 * reporting the same state, and drops back to the minimum on any state change.
 *
 * A job whose elapsed time reaches {@link JobPolicy#maxDuration()} is moved to
 * {@link JobState#TIMED_OUT}; that is the only timeout applied to external work.
 *
 * Callers wait for a job through {@link #completion(String)}. It completes on
 * the completion executor, never on a poll thread, so a waiter that fetches
 * results with retries cannot hold up the polls and timeouts of other jobs.
 */
public class JobLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycleManager.class);

    private static final String RESERVED = "";

    private final BatchScheduler           scheduler;
    private final ScheduledExecutorService pollExecutor;
    private final Executor                 completionExecutor;
    private final JobPolicy                policy;
    private final TransitionLog            transitionLog;
    private final MeterRegistry            meterRegistry;
    private final Clock                    clock;
    private final Sleeper                  sleeper;

    private final Map<String, Job>  jobs               = new ConcurrentHashMap<>();
    private final Map<Long, String> activeByInvocation = new ConcurrentHashMap<>();
    private final AtomicLong        sequence           = new AtomicLong();

    public JobLifecycleManager(BatchScheduler scheduler,
                               ScheduledExecutorService pollExecutor,
                               Executor completionExecutor,
                               JobPolicy policy,
                               TransitionLog transitionLog,
                               MeterRegistry meterRegistry,
                               Clock clock,
                               Sleeper sleeper) {
        this.scheduler          = scheduler;
        this.pollExecutor       = pollExecutor;
        this.completionExecutor = completionExecutor;
        this.policy             = policy;
        this.transitionLog      = transitionLog;
        this.meterRegistry      = meterRegistry;
        this.clock              = clock;
        this.sleeper            = sleeper;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Submit a job on behalf of an invocation.
     *
     * Transient scheduler failures are retried with exponential backoff.
     *
     * @return the new job's id
     * @throws SubmissionException   if the scheduler rejected the job or kept failing;
     *                               no job record exists afterwards
     * @throws IllegalStateException if the invocation already owns an active job
     */
    public String submit(JobSpec spec, long invocationId) {
        if (activeByInvocation.putIfAbsent(invocationId, RESERVED) != null) {
            throw new IllegalStateException("Invocation " + invocationId + " already owns an active job");
        }

        String handle;
        try {
            handle = withRetries("submit " + spec.jobType(), () -> scheduler.submit(spec));
        } catch (BatchSchedulerException e) {
            activeByInvocation.remove(invocationId, RESERVED);
            meterRegistry.counter("mdpilot.job.submissions", "outcome", "error").increment();
            throw new SubmissionException("Submission of " + spec.jobType() + " job failed: " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        String jobId = "job-" + sequence.incrementAndGet();
        Job job = new Job(jobId, invocationId, handle, spec, now, policy.minPollInterval());
        jobs.put(jobId, job);
        activeByInvocation.put(invocationId, jobId);
        meterRegistry.counter("mdpilot.job.submissions", "outcome", "success").increment();

        log.info("Submitted {} job {} (handle {}) for invocation {}: {} node(s), {} GPU(s)/node, walltime {}",
                spec.jobType(), jobId, handle, invocationId,
                spec.nodes(), spec.gpusPerNode(), spec.walltimeText());
        transitionLog.append(Transition.job(now, invocationId, jobId, null, JobState.SUBMITTED,
                "handle " + handle));

        synchronized (job) {
            reschedulePoll(job, now);
        }
        return jobId;
    }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    /**
     * Perform one status check against the scheduler and update the job.
     *
     * A terminal job is returned unchanged without contacting the scheduler.
     * The job's queued poll is replaced, so calling this directly never adds a
     * second polling chain.
     */
    public JobState poll(String jobId) {
        Job job = require(jobId);
        synchronized (job) {
            if (job.getState().isTerminal()) {
                return job.getState();
            }
            Instant now = clock.instant();
            Duration interval;
            try {
                SchedulerStatus status = scheduler.status(job.getHandle());
                job.recordPoll(status.detail());
                meterRegistry.counter("mdpilot.job.polls", "outcome", "success").increment();

                JobState mapped = JobState.fromScheduler(status.state());
                boolean changed = false;
                if (mapped == null) {
                    log.warn("Job {} reported unknown scheduler state '{}'; treating as unchanged",
                            jobId, status.state());
                } else {
                    changed = advance(job, mapped, now, describe(status));
                }
                interval = changed ? policy.minPollInterval() : policy.nextInterval(job.getPollInterval());
            } catch (BatchSchedulerException e) {
                int failures = job.recordPollFailure();
                meterRegistry.counter("mdpilot.job.polls", "outcome", "error").increment();
                if (!e.isTransient() || failures >= policy.maxAttempts()) {
                    log.error("Status check for job {} failed ({} consecutive): {}", jobId, failures, e.getMessage());
                    advance(job, JobState.FAILED, now, "Status check failed: " + e.getMessage());
                } else {
                    log.warn("Transient status check failure {}/{} for job {}: {}",
                            failures, policy.maxAttempts(), jobId, e.getMessage());
                }
                interval = policy.nextInterval(job.getPollInterval());
            }

            if (!job.getState().isTerminal()
                    && !now.isBefore(job.getSubmittedAt().plus(policy.maxDuration()))) {
                cancelExternally(job);
                advance(job, JobState.TIMED_OUT, now,
                        "No terminal state within " + policy.maxDuration());
            }

            if (job.getState().isTerminal()) {
                job.replacePendingPoll(null);
            } else {
                job.scheduleNext(interval, now.plus(interval));
                reschedulePoll(job, now);
            }
        }
        settle(job);
        return job.getState();
    }

    private void pollSafely(String jobId) {
        try {
            poll(jobId);
        } catch (Exception e) {
            log.error("Unhandled error polling job {}: {}", jobId, e.getMessage(), e);
            Job job = jobs.get(jobId);
            if (job != null) {
                synchronized (job) {
                    advance(job, JobState.FAILED, clock.instant(), "Polling error: " + e.getMessage());
                    job.replacePendingPoll(null);
                }
                settle(job);
            }
        }
    }

    /**
     * Queue the next poll at {@code nextPollAt}, never past the job's deadline,
     * in place of any poll already queued. Caller holds the job's monitor.
     */
    private void reschedulePoll(Job job, Instant now) {
        Instant deadline = job.getSubmittedAt().plus(policy.maxDuration());
        Instant at = job.getNextPollAt().isAfter(deadline) ? deadline : job.getNextPollAt();
        job.scheduleNext(job.getPollInterval(), at);
        long delayMillis = Math.max(0, Duration.between(now, at).toMillis());
        try {
            job.replacePendingPoll(
                    pollExecutor.schedule(() -> pollSafely(job.getId()), delayMillis, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            job.replacePendingPoll(null);
            log.warn("Poll executor rejected job {}; it will not be polled again: {}", job.getId(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /** Cancel a job. The external cancel is best-effort; the record becomes CANCELLED regardless. */
    public JobState cancel(String jobId) {
        Job job = require(jobId);
        synchronized (job) {
            if (job.getState().isTerminal()) {
                return job.getState();
            }
            cancelExternally(job);
            advance(job, JobState.CANCELLED, clock.instant(), "Cancelled on request");
            job.replacePendingPoll(null);
        }
        settle(job);
        return job.getState();
    }

    /** Cancel every job that is not yet terminal. */
    public void cancelAll() {
        jobs.values().stream()
                .filter(j -> !j.getState().isTerminal())
                .forEach(j -> cancel(j.getId()));
    }

    private void cancelExternally(Job job) {
        try {
            scheduler.cancel(job.getHandle());
        } catch (BatchSchedulerException e) {
            log.warn("External cancel of job {} (handle {}) failed: {}", job.getId(), job.getHandle(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    /**
     * Fetch the output of a completed job. Transient failures are retried.
     *
     * @throws JobNotCompleteException unless the job is COMPLETED
     * @throws BatchSchedulerException if the result could not be fetched
     */
    public Map<String, Object> fetchResult(String jobId) {
        Job job = require(jobId);
        if (job.getState() != JobState.COMPLETED) {
            throw new JobNotCompleteException(jobId, job.getState());
        }
        return withRetries("fetch result of " + jobId, () -> scheduler.fetchResult(job.getHandle()));
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Completes with the job once it reaches a terminal state. */
    public CompletableFuture<Job> completion(String jobId) {
        return require(jobId).completion().copy();
    }

    public Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobId == null ? null : jobs.get(jobId));
    }

    public Optional<Job> activeJobFor(long invocationId) {
        String jobId = activeByInvocation.get(invocationId);
        return jobId == null || jobId.isEmpty() ? Optional.empty() : find(jobId);
    }

    /** All jobs of this run, oldest first. */
    public List<Job> jobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::getSubmittedAt).thenComparing(Job::getId))
                .toList();
    }

    public JobPolicy policy() {
        return policy;
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private Job require(String jobId) {
        Job job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job: " + jobId);
        }
        return job;
    }

    /** Caller holds the job's monitor. */
    private boolean advance(Job job, JobState next, Instant at, String reason) {
        JobState from = job.getState();
        if (!job.advance(next, at, reason)) {
            return false;
        }
        log.info("Job {} {} -> {}{}", job.getId(), from, next, reason == null ? "" : " (" + reason + ")");
        transitionLog.append(Transition.job(at, job.getInvocationId(), job.getId(), from, next, reason));
        if (next.isTerminal()) {
            meterRegistry.counter("mdpilot.job.terminal", "state", next.name().toLowerCase()).increment();
        }
        return true;
    }

    /**
     * Release the invocation's job slot and hand the waiters to the completion
     * executor. Called without the job's monitor.
     */
    private void settle(Job job) {
        if (!job.getState().isTerminal() || !job.markSettled()) {
            return;
        }
        activeByInvocation.remove(job.getInvocationId(), job.getId());
        try {
            completionExecutor.execute(() -> job.completion().complete(job));
        } catch (RejectedExecutionException e) {
            log.warn("Completion executor rejected job {}; completing on {}: {}",
                    job.getId(), Thread.currentThread().getName(), e.getMessage());
            job.completion().complete(job);
        }
    }

    private static String describe(SchedulerStatus status) {
        return status.detail() == null || status.detail().isBlank()
                ? "scheduler state " + status.state()
                : "scheduler state " + status.state() + ": " + status.detail();
    }

    private <T> T withRetries(String action, Supplier<T> call) {
        Duration backoff = policy.retryBackoff();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (BatchSchedulerException e) {
                if (!e.isTransient() || attempt >= policy.maxAttempts()) {
                    throw e;
                }
                log.warn("Attempt {}/{} to {} failed, retrying in {}: {}",
                        attempt, policy.maxAttempts(), action, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new BatchSchedulerException("Interrupted while retrying " + action, false, e);
                }
                backoff = backoff.multipliedBy(2);
            }
        }
    }
}
