package com.mdpilot.orchestrator.capability.impl;

import com.mdpilot.orchestrator.capability.Capability;
import com.mdpilot.orchestrator.capability.CapabilityExecutor;
import com.mdpilot.orchestrator.capability.ExecutionResult;
import com.mdpilot.orchestrator.capability.InvocationContext;
import com.mdpilot.orchestrator.gate.GateState;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-JVM capability that reports which gates are open. Never changes a gate.
 */
@Component
public class WorkflowStatusExecutor implements CapabilityExecutor {

    public static final String ID = "local";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ExecutionResult execute(Capability capability, Map<String, Object> args, InvocationContext ctx) {
        Map<String, GateState> gates = ctx.gates();
        List<String> open = gates.entrySet().stream()
                .filter(e -> e.getValue() == GateState.OPEN)
                .map(Map.Entry::getKey)
                .toList();
        List<String> blocked = gates.entrySet().stream()
                .filter(e -> e.getValue() == GateState.BLOCKED)
                .map(Map.Entry::getKey)
                .toList();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("open", open);
        result.put("blocked", blocked);
        result.put("total", gates.size());
        return ExecutionResult.succeeded(
                "%d of %d gates open%s".formatted(open.size(), gates.size(),
                        blocked.isEmpty() ? "" : ", blocked: " + String.join(", ", blocked)),
                result);
    }
}
