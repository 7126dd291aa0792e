package com.mdpilot.orchestrator.job;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One external batch job, from submission to a terminal state.
 *
 * Owned by {@link JobLifecycleManager}; every mutation happens while the
 * manager holds this object's monitor. Readers on other threads see a
 * consistent value per field through the volatile fields.
 */
public class Job {

    private final String   id;
    private final long     invocationId;
    private final String   handle;
    private final JobSpec  spec;
    private final Instant  submittedAt;

    private volatile JobState state = JobState.SUBMITTED;
    private volatile int      pollCount;
    private volatile int      consecutivePollFailures;
    private volatile Duration pollInterval;
    private volatile Instant  nextPollAt;
    private volatile Instant  finishedAt;
    private volatile String   failureReason;
    private volatile String   schedulerDetail;

    private ScheduledFuture<?> pendingPoll;

    private final CompletableFuture<Job> completion = new CompletableFuture<>();
    private final AtomicBoolean          settled    = new AtomicBoolean();

    Job(String id, long invocationId, String handle, JobSpec spec,
        Instant submittedAt, Duration firstInterval) {
        this.id           = id;
        this.invocationId = invocationId;
        this.handle       = handle;
        this.spec         = spec;
        this.submittedAt  = submittedAt;
        this.pollInterval = firstInterval;
        this.nextPollAt   = submittedAt.plus(firstInterval);
    }

    // ------------------------------------------------------------------
    // Mutations (JobLifecycleManager only, under this object's monitor)
    // ------------------------------------------------------------------

    /** Move to {@code next} if that is forward progress; returns whether the state changed. */
    boolean advance(JobState next, Instant at, String reason) {
        if (!state.canAdvanceTo(next)) {
            return false;
        }
        state = next;
        if (next.isTerminal()) {
            finishedAt    = at;
            failureReason = reason;
        }
        return true;
    }

    void recordPoll(String detail) {
        pollCount++;
        consecutivePollFailures = 0;
        schedulerDetail = detail;
    }

    int recordPollFailure() {
        pollCount++;
        return ++consecutivePollFailures;
    }

    void scheduleNext(Duration interval, Instant at) {
        pollInterval = interval;
        nextPollAt   = at;
    }

    /** Replace the queued poll; the previous one is cancelled if it has not started. */
    void replacePendingPoll(ScheduledFuture<?> next) {
        if (pendingPoll != null) {
            pendingPoll.cancel(false);
        }
        pendingPoll = next;
    }

    CompletableFuture<Job> completion() {
        return completion;
    }

    /** True exactly once, for the caller that gets to release this job's waiters. */
    boolean markSettled() {
        return settled.compareAndSet(false, true);
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public String   getId()                      { return id; }
    public long     getInvocationId()            { return invocationId; }
    public String   getHandle()                  { return handle; }
    public JobSpec  getSpec()                    { return spec; }
    public Instant  getSubmittedAt()             { return submittedAt; }
    public JobState getState()                   { return state; }
    public int      getPollCount()               { return pollCount; }
    public int      getConsecutivePollFailures() { return consecutivePollFailures; }
    public Duration getPollInterval()            { return pollInterval; }
    public Instant  getNextPollAt()              { return nextPollAt; }
    public Instant  getFinishedAt()              { return finishedAt; }
    public String   getFailureReason()           { return failureReason; }
    public String   getSchedulerDetail()         { return schedulerDetail; }

    @Override
    public String toString() {
        return "Job[" + id + " " + state + " handle=" + handle + " invocation=" + invocationId + "]";
    }
}
