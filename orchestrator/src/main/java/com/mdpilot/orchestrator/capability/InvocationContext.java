package com.mdpilot.orchestrator.capability;

import com.mdpilot.orchestrator.gate.GateState;

import java.util.Map;
import java.util.UUID;

/**
 * Runtime context passed to every executor call.
 *
 * Executors use this to tag remote calls and logs with the owning run and
 * invocation, and to read the gate states the invocation was admitted under.
 */
public record InvocationContext(
        UUID                   runId,
        long                   invocationId,
        String                 capability,
        Map<String, GateState> gates) {}
