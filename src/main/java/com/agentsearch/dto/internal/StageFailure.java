package com.agentsearch.dto.internal;

/**
 * A degraded step of a pipeline run. The run still completes; these records
 * explain what was replaced by a fallback.
 */
public record StageFailure(
    FailureKind kind,
    PipelineStage stage,
    String detail
) {
}
