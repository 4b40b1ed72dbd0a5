package com.market.intel.pipeline.model;

import java.time.Instant;

public record RunSummary(
    String runId,
    String command,
    RunStatus status,
    Instant startedAt,
    Instant finishedAt,
    int sourceCount,
    int liveSourceCount,
    int captureCount,
    int documentCount,
    int duplicateCount,
    int droppedEmptyCount,
    int analysisFailureCount,
    int profileCount,
    int failureCount,
    String outputDirectory,
    String notes
) {
}
