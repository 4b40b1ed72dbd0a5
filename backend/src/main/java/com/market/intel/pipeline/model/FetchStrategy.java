package com.market.intel.pipeline.model;

public enum FetchStrategy {
    STATIC,
    DYNAMIC
}
