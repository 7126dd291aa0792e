package com.mdpilot.orchestrator.capability.impl;

import com.mdpilot.orchestrator.capability.Capability;
import com.mdpilot.orchestrator.capability.ExecutionResult;
import com.mdpilot.orchestrator.capability.GateUpdate;
import com.mdpilot.orchestrator.capability.InvocationContext;
import com.mdpilot.orchestrator.capability.JobBackedExecutor;
import com.mdpilot.orchestrator.executor.dto.GateUpdatePayload;
import com.mdpilot.orchestrator.job.JobSpec;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs simulation capabilities (OpenMM production runs, WESTPA iterations) as
 * cluster jobs.
 *
 * Resource arguments ({@code nodes}, {@code gpus_per_node}, {@code walkers},
 * {@code walltime}) become the job's resource request; everything else is
 * forwarded as the job payload.
 *
 * When the job has finished, the job output decides the gate effects: explicit
 * {@code gate_updates} from the job win; otherwise exit code 0 opens every
 * affected gate and anything else blocks them.
 */
@Component
public class BatchSimulationExecutor implements JobBackedExecutor {

    public static final String ID = "batch-scheduler";

    static final int      DEFAULT_NODES         = 1;
    static final int      DEFAULT_GPUS_PER_NODE = 1;
    static final int      MAX_GPUS_PER_NODE     = 8;
    static final Duration DEFAULT_WALLTIME      = Duration.ofHours(24);

    private static final Pattern WALLTIME = Pattern.compile("(\\d+):([0-5]\\d):([0-5]\\d)");
    private static final Set<String> RESOURCE_ARGS = Set.of("nodes", "gpus_per_node", "walkers", "walltime");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public JobSpec prepareJob(Capability capability, Map<String, Object> args, InvocationContext ctx) {
        int nodes = intArg(args, "nodes", DEFAULT_NODES);
        int gpus  = args.containsKey("walkers")
                ? Math.min(intArg(args, "walkers", DEFAULT_GPUS_PER_NODE), MAX_GPUS_PER_NODE)
                : intArg(args, "gpus_per_node", DEFAULT_GPUS_PER_NODE);
        Duration walltime = args.get("walltime") == null
                ? DEFAULT_WALLTIME
                : parseWalltime(String.valueOf(args.get("walltime")));

        Map<String, Object> payload = new LinkedHashMap<>();
        args.forEach((key, value) -> {
            if (!RESOURCE_ARGS.contains(key) || "walkers".equals(key)) {
                payload.put(key, value);
            }
        });
        payload.put("run_id", ctx.runId().toString());
        payload.put("invocation_id", ctx.invocationId());

        String jobName = capability.name() + "-" + ctx.runId().toString().substring(0, 8) + "-" + ctx.invocationId();
        return new JobSpec(capability.name(), jobName, payload, nodes, gpus, walltime);
    }

    @Override
    public ExecutionResult interpretResult(Capability capability, Map<String, Object> args,
                                           Map<String, Object> jobOutput, InvocationContext ctx) {
        Object explicit = jobOutput.get("gate_updates");
        if (explicit instanceof List<?> list) {
            List<GateUpdate> updates = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    updates.add(ToolServiceExecutor.toGateUpdate(new GateUpdatePayload(
                            String.valueOf(map.get("gate")),
                            String.valueOf(map.get("state")),
                            map.get("evidence") == null ? "" : String.valueOf(map.get("evidence")))));
                }
            }
            boolean success = !Boolean.FALSE.equals(jobOutput.get("success"));
            return new ExecutionResult(success, message(jobOutput, success), jobOutput, updates);
        }

        Object exitCode = jobOutput.get("exit_code");
        boolean success = exitCode == null || (exitCode instanceof Number n && n.intValue() == 0);
        String evidence = success
                ? "Job finished: " + summary(jobOutput)
                : "Job exited with code " + exitCode + ": " + summary(jobOutput);
        List<GateUpdate> updates = capability.affectedGates().stream()
                .map(gate -> success ? GateUpdate.open(gate, evidence) : GateUpdate.blocked(gate, evidence))
                .toList();
        return new ExecutionResult(success, message(jobOutput, success), jobOutput, updates);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static Duration parseWalltime(String text) {
        Matcher m = WALLTIME.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("walltime must be HH:MM:SS, got '" + text + "'");
        }
        Duration walltime = Duration.ofHours(Long.parseLong(m.group(1)))
                .plusMinutes(Long.parseLong(m.group(2)))
                .plusSeconds(Long.parseLong(m.group(3)));
        if (walltime.isZero()) {
            throw new IllegalArgumentException("walltime must be positive");
        }
        return walltime;
    }

    private static int intArg(Map<String, Object> args, String key, int fallback) {
        Object value = args.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be a number, got " + value);
    }

    private static String message(Map<String, Object> jobOutput, boolean success) {
        Object message = jobOutput.get("message");
        if (message != null) {
            return String.valueOf(message);
        }
        return success ? "Simulation job completed" : "Simulation job failed";
    }

    private static String summary(Map<String, Object> jobOutput) {
        Object files = jobOutput.get("output_files");
        if (files instanceof List<?> list && !list.isEmpty()) {
            return list.size() + " output file(s), e.g. " + list.get(0);
        }
        Object elapsed = jobOutput.get("elapsed");
        return elapsed != null ? "elapsed " + elapsed : "no output listing";
    }
}
