package com.market.intel.pipeline.model;

public record Source(
    String id,
    String url,
    String name,
    SourceStrategy strategy,
    SourceCategory category,
    int rowIndex
) {
}
