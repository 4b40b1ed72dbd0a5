package com.market.intel.pipeline.model;

public enum RunStatus {
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED,
    CANCELLED
}
