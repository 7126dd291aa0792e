package com.mdpilot.orchestrator.claude;

import com.mdpilot.orchestrator.capability.CapabilityRegistry;
import com.mdpilot.orchestrator.dispatch.Outcome;
import com.mdpilot.orchestrator.gate.Gate;
import com.mdpilot.orchestrator.memory.Correction;
import com.mdpilot.orchestrator.oracle.PipelineSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prompt text for the Claude-backed oracle.
 *
 * The capability section is generated from the live {@link CapabilityRegistry},
 * so the oracle only ever sees capabilities that can actually be dispatched.
 */
@Component
public class OraclePrompts {

    private final String systemPrompt;

    public OraclePrompts(CapabilityRegistry registry) {
        this.systemPrompt = SYSTEM_PROMPT.replace("{{CAPABILITIES}}", registry.describeCapabilities());
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    /** First message of a run: the goal, then the same sections as every later turn. */
    public String initialMessage(PipelineSnapshot snapshot, List<String> operatorFeedback) {
        return "GOAL: " + snapshot.goal() + "\n\n" + turnMessage(snapshot, operatorFeedback);
    }

    /** Follow-up message: what happened since the last decision. */
    public String turnMessage(PipelineSnapshot snapshot, List<String> operatorFeedback) {
        StringBuilder sb = new StringBuilder();
        if (!snapshot.observations().isEmpty()) {
            sb.append("OBSERVATIONS:\n");
            for (Outcome o : snapshot.observations()) {
                sb.append("  ").append(o.toObservation()).append("\n");
            }
            sb.append("\n");
        }
        List<Outcome> running = snapshot.history().stream().filter(o -> !o.isTerminal()).toList();
        if (!running.isEmpty()) {
            sb.append("STILL RUNNING:\n");
            running.forEach(o -> sb.append("  ").append(o.toObservation()).append("\n"));
            sb.append("\n");
        }
        if (!snapshot.corrections().isEmpty()) {
            sb.append("PRIOR CORRECTIONS for this step (most relevant first). Apply them before proceeding:\n");
            for (Correction c : snapshot.corrections()) {
                sb.append("  - ").append(c.content()).append("\n");
            }
            sb.append("\n");
        }
        if (!operatorFeedback.isEmpty()) {
            sb.append("OPERATOR CORRECTION:\n");
            operatorFeedback.forEach(f -> sb.append("  ").append(f).append("\n"));
            sb.append("\n");
        }
        appendGates(sb, snapshot);
        appendBudget(sb, snapshot);
        return sb.toString();
    }

    public String formatReminder(String problem) {
        return "Your reply could not be used (" + problem + "). Reply with exactly one "
                + "<action>{\"capability\": ..., \"args\": {...}}</action>, <await/> or <done/>.";
    }

    private static void appendGates(StringBuilder sb, PipelineSnapshot snapshot) {
        sb.append("GATES:\n");
        for (Gate gate : snapshot.gates().values()) {
            sb.append("  ").append(gate.name()).append(": ").append(gate.state());
            if (!gate.evidence().isBlank()) {
                sb.append(" (").append(gate.evidence()).append(")");
            }
            sb.append("\n");
        }
    }

    private static void appendBudget(StringBuilder sb, PipelineSnapshot snapshot) {
        sb.append("\nActions used: ").append(snapshot.proposalsUsed())
          .append(" of ").append(snapshot.proposalBudget()).append("\n");
    }

    private static final String SYSTEM_PROMPT = """
            You are the coordinator of a molecular dynamics pipeline. Specialist agents
            carry out each step; you decide which capability runs next.

            The pipeline moves through validation gates:
              structure download -> cleaning and validation -> force-field coverage
              -> system preparation -> simulation -> analysis.
            A capability is only admitted when every gate it requires is OPEN. A rejected
            action tells you which gates are missing; fix them instead of retrying.
            Never work around a BLOCKED gate: run the capability that re-validates it.

            {{CAPABILITIES}}
            Simulations run as batch jobs on the cluster and take hours. While one runs you
            may start independent work, or wait for it.

            Reply with exactly ONE of:
              <action>{"capability": "<name>", "args": {<arguments>}}</action>
              <await/>   wait until a running job finishes
              <done/>    the goal has been reached (or cannot be reached)

            Think briefly before the tag. Use only the capabilities and argument names listed.
            """;
}
