package com.mdpilot.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One gate change reported by a tool: {@code state} is "open" or "blocked".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GateUpdatePayload(
        String gate,
        String state,
        String evidence
) {}
