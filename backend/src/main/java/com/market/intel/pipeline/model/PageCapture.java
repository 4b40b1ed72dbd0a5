package com.market.intel.pipeline.model;

import java.time.Instant;

public record PageCapture(
    String captureId,
    String sourceId,
    String sourceUrl,
    String sourceName,
    SourceCategory category,
    int sourceIndex,
    int pageIndex,
    String requestedUrl,
    String finalUrl,
    FetchStrategy strategy,
    int statusCode,
    boolean live,
    Instant fetchedAt,
    String snapshotPath,
    String html
) {
}
