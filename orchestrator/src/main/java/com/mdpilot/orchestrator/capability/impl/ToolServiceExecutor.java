package com.mdpilot.orchestrator.capability.impl;

import com.mdpilot.orchestrator.capability.Capability;
import com.mdpilot.orchestrator.capability.CapabilityExecutor;
import com.mdpilot.orchestrator.capability.ExecutionResult;
import com.mdpilot.orchestrator.capability.GateUpdate;
import com.mdpilot.orchestrator.capability.InvocationContext;
import com.mdpilot.orchestrator.executor.ToolServiceClient;
import com.mdpilot.orchestrator.executor.ToolServiceException;
import com.mdpilot.orchestrator.executor.dto.GateUpdatePayload;
import com.mdpilot.orchestrator.executor.dto.ToolResponse;
import com.mdpilot.orchestrator.gate.GateState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs synchronous capabilities in the remote tool service.
 *
 * The tool's own verdict and gate updates are passed through unchanged; the
 * dispatcher decides which of the updates the capability may apply.
 */
@Component
public class ToolServiceExecutor implements CapabilityExecutor {

    public static final String ID = "tool-service";

    private final ToolServiceClient client;

    public ToolServiceExecutor(ToolServiceClient client) {
        this.client = client;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ExecutionResult execute(Capability capability, Map<String, Object> args, InvocationContext ctx) {
        ToolResponse response = client.invoke(capability.name(), args, ctx.runId(), ctx.invocationId());
        List<GateUpdate> updates = response.gate_updates() == null
                ? List.of()
                : response.gate_updates().stream().map(ToolServiceExecutor::toGateUpdate).toList();
        return new ExecutionResult(response.success(), response.message(), response.result(), updates);
    }

    static GateUpdate toGateUpdate(GateUpdatePayload payload) {
        GateState state;
        try {
            state = GateState.valueOf(String.valueOf(payload.state()).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ToolServiceException("Tool reported invalid state '" + payload.state()
                    + "' for gate '" + payload.gate() + "'", e);
        }
        return new GateUpdate(payload.gate(), state, payload.evidence());
    }
}
