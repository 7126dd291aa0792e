package com.mdpilot.orchestrator.pipeline;

/** How a pipeline run ended, as surfaced to whatever presents it. */
public enum PipelineSignal {
    PIPELINE_COMPLETE,
    PIPELINE_FAILED,
    PIPELINE_CANCELLED
}
