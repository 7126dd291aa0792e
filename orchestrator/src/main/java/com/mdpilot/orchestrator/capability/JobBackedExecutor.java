package com.mdpilot.orchestrator.capability;

import com.mdpilot.orchestrator.job.JobSpec;

import java.util.Map;

/**
 * Executor for {@link ExecutionMode#JOB} capabilities.
 *
 * The dispatcher asks it for a {@link JobSpec}, hands that to the job manager,
 * and once the job has completed passes the fetched job output back through
 * {@link #interpretResult} to obtain the gate side effects.
 *
 * {@link #execute} is never called for job-backed capabilities.
 */
public interface JobBackedExecutor extends CapabilityExecutor {

    JobSpec prepareJob(Capability capability, Map<String, Object> args, InvocationContext ctx);

    ExecutionResult interpretResult(Capability capability, Map<String, Object> args,
                                    Map<String, Object> jobOutput, InvocationContext ctx);

    @Override
    default ExecutionResult execute(Capability capability, Map<String, Object> args, InvocationContext ctx) {
        throw new UnsupportedOperationException(
                "'" + capability.name() + "' runs as a batch job; use prepareJob()");
    }
}
