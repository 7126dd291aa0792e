package com.mdpilot.orchestrator.capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What an executor reports back for one invocation.
 *
 * {@code success=false} is a declared domain failure (e.g. "structure has
 * missing residues"); it still carries gate updates, typically blocking the
 * gate it was asked to validate. Unexpected failures are thrown instead and
 * become executor faults at the dispatcher.
 *
 * @param success     Executor's own verdict.
 * @param message     Human-readable summary.
 * @param result      Free-form payload returned to the oracle.
 * @param gateUpdates Gate side effects to apply.
 */
public record ExecutionResult(
        boolean             success,
        String              message,
        Map<String, Object> result,
        List<GateUpdate>    gateUpdates) {

    public ExecutionResult {
        message     = message == null ? "" : message;
        result      = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
        gateUpdates = List.copyOf(gateUpdates == null ? List.of() : gateUpdates);
    }

    public static ExecutionResult succeeded(String message, Map<String, Object> result, GateUpdate... updates) {
        return new ExecutionResult(true, message, result, List.of(updates));
    }

    public static ExecutionResult failed(String message, GateUpdate... updates) {
        return new ExecutionResult(false, message, Map.of(), List.of(updates));
    }
}
