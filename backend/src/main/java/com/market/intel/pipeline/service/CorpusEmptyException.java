package com.market.intel.pipeline.service;

public class CorpusEmptyException extends RuntimeException {
    public CorpusEmptyException(String message) {
        super(message);
    }
}
