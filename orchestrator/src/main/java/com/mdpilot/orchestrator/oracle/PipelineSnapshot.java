package com.mdpilot.orchestrator.oracle;

import com.mdpilot.orchestrator.dispatch.Outcome;
import com.mdpilot.orchestrator.gate.Gate;
import com.mdpilot.orchestrator.memory.Correction;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Everything the oracle sees when asked for the next action.
 *
 * @param runId             Pipeline run.
 * @param goal              What the operator asked for.
 * @param gates             Current gate ledger, by name.
 * @param history           Every invocation so far, ordered by id.
 * @param observations      Outcomes not yet shown to the oracle, oldest first.
 * @param corrections       Recalled corrections for the capability about to be proposed;
 *                          empty unless the loop is asking again before a correction-sensitive call.
 * @param capabilityCatalog Rendered list of available capabilities.
 * @param proposalsUsed     Proposals made so far.
 * @param proposalBudget    Maximum proposals for the run.
 */
public record PipelineSnapshot(
        UUID              runId,
        String            goal,
        Map<String, Gate> gates,
        List<Outcome>     history,
        List<Outcome>     observations,
        List<Correction>  corrections,
        String            capabilityCatalog,
        int               proposalsUsed,
        int               proposalBudget) {

    public PipelineSnapshot {
        gates        = Collections.unmodifiableMap(new TreeMap<>(gates));
        history      = List.copyOf(history);
        observations = List.copyOf(observations);
        corrections  = List.copyOf(corrections);
    }

    public boolean hasOutstandingInvocations() {
        return history.stream().anyMatch(o -> !o.isTerminal());
    }
}
