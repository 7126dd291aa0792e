package com.mdpilot.orchestrator.job;

import java.util.Map;

/**
 * The external batch system jobs are submitted to (an HPC cluster behind a gateway).
 *
 * Every method may throw {@link BatchSchedulerException}; transient failures
 * (transport errors, overload) are flagged so the job manager can retry them.
 */
public interface BatchScheduler {

    /** Submit a job and return the scheduler's opaque handle for it. */
    String submit(JobSpec spec);

    SchedulerStatus status(String handle);

    void cancel(String handle);

    /** Output of a completed job (file list, energies, exit code, ...). */
    Map<String, Object> fetchResult(String handle);
}
