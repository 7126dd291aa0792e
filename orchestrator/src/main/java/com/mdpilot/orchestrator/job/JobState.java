package com.mdpilot.orchestrator.job;

import java.util.Locale;

/**
 * Lifecycle of a batch job owned by the job manager.
 *
 * Transitions:
 *   SUBMITTED → QUEUED → RUNNING → COMPLETED | FAILED | TIMED_OUT
 *   any non-terminal state → CANCELLED (explicit cancel request)
 *
 * A state may be skipped (a short job can go straight from QUEUED to
 * COMPLETED between two polls) but never revisited.
 */
public enum JobState {
    SUBMITTED(0),
    QUEUED(1),
    RUNNING(2),
    COMPLETED(3),
    FAILED(3),
    TIMED_OUT(3),
    CANCELLED(3);

    private final int rank;

    JobState(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 3;
    }

    /** True when moving from this state to {@code next} is forward progress. */
    public boolean canAdvanceTo(JobState next) {
        return !isTerminal() && next.rank > rank;
    }

    /**
     * Map a scheduler-reported state (Slurm squeue/sacct vocabulary) onto the
     * job lifecycle. Returns null for states the orchestrator does not know.
     *
     * Slurm's own TIMEOUT means the job hit its walltime; that is a job
     * failure, distinct from the orchestrator's TIMED_OUT deadline.
     */
    public static JobState fromScheduler(String schedulerState) {
        if (schedulerState == null) {
            return null;
        }
        return switch (schedulerState.trim().toUpperCase(Locale.ROOT)) {
            case "SUBMITTED"                   -> SUBMITTED;
            case "PENDING", "CONFIGURING",
                 "REQUEUED", "SUSPENDED"       -> QUEUED;
            case "RUNNING", "COMPLETING"       -> RUNNING;
            case "COMPLETED"                   -> COMPLETED;
            case "FAILED", "NODE_FAIL", "OUT_OF_MEMORY",
                 "BOOT_FAIL", "DEADLINE", "TIMEOUT",
                 "PREEMPTED"                   -> FAILED;
            case "CANCELLED"                   -> CANCELLED;
            default                            -> null;
        };
    }
}
