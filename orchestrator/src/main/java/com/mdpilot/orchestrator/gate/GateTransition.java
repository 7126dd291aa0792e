package com.mdpilot.orchestrator.gate;

import java.time.Instant;

/**
 * One entry in the ledger's append-only history.
 * The history is the evidence trail surfaced when a pipeline halts.
 */
public record GateTransition(
        String    gate,
        GateState from,
        GateState to,
        String    evidence,
        long      invocationId,
        Instant   at) {}
