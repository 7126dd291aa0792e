package com.mdpilot.orchestrator.api.dto;

/**
 * Request body for POST /pipelines.
 *
 * goal is free text handed to the oracle, e.g.
 * "Prepare and run a 100 ns simulation of PDB 1UBQ in explicit water".
 */
public record StartPipelineRequest(String goal) {}
