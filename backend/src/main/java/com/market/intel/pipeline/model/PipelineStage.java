package com.market.intel.pipeline.model;

public enum PipelineStage {
    FETCH,
    EXTRACT,
    NORMALIZE,
    ANALYZE,
    AGGREGATE
}
