package com.mdpilot.orchestrator.api.dto;

/** Request body for POST /pipelines/{id}/corrections. */
public record CorrectionRequest(String text) {}
