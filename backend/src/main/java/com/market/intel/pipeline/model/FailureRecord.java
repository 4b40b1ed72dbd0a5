package com.market.intel.pipeline.model;

import java.time.Instant;

public record FailureRecord(
    Instant timestamp,
    String runId,
    String sourceId,
    String url,
    PipelineStage stage,
    ErrorKind errorKind,
    String reasonCode,
    String message
) {
}
