package com.mdpilot.orchestrator.job;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable description of a batch job, produced by a job-backed executor.
 *
 * @param jobType     Kind of job ("run_simulation", "westpa_iterations", ...);
 *                    resubmission policy is configured per type.
 * @param jobName     Scheduler-visible name.
 * @param payload     Job-specific parameters forwarded to the batch gateway.
 * @param nodes       Compute nodes requested.
 * @param gpusPerNode GPUs requested per node.
 * @param walltime    Scheduler walltime limit.
 */
public record JobSpec(
        String              jobType,
        String              jobName,
        Map<String, Object> payload,
        int                 nodes,
        int                 gpusPerNode,
        Duration            walltime) {

    public JobSpec {
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType must not be blank");
        }
        if (nodes < 1) {
            throw new IllegalArgumentException("nodes must be at least 1, got " + nodes);
        }
        if (gpusPerNode < 0) {
            throw new IllegalArgumentException("gpusPerNode must not be negative, got " + gpusPerNode);
        }
        payload  = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        walltime = walltime == null ? Duration.ofHours(24) : walltime;
        jobName  = jobName == null || jobName.isBlank() ? jobType : jobName;
    }

    /** Slurm-style "HH:MM:SS" rendering of the walltime. */
    public String walltimeText() {
        long seconds = walltime.getSeconds();
        return "%02d:%02d:%02d".formatted(seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
