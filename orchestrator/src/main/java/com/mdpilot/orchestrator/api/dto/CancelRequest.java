package com.mdpilot.orchestrator.api.dto;

/** Optional request body for POST /pipelines/{id}/cancel. */
public record CancelRequest(String reason) {}
