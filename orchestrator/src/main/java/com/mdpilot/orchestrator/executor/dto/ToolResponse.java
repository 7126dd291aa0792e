package com.mdpilot.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Response from POST /tools/{capability}.
 * Must match ToolResponse in the tool service's models.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolResponse(
        boolean success,
        String message,
        Map<String, Object> result,
        List<GateUpdatePayload> gate_updates
) {}
