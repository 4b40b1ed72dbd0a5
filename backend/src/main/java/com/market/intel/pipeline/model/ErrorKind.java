package com.market.intel.pipeline.model;

public enum ErrorKind {
    FETCH_TRANSIENT,
    FETCH_FAILED,
    EXTRACTION_PARTIAL,
    ANALYSIS_FAILED,
    CORPUS_EMPTY
}
