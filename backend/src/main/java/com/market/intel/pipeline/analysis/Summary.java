package com.market.intel.pipeline.analysis;

public record Summary(String text, String method) {
    public static final String EXTRACTIVE = "extractive";
    public static final String GENERATIVE = "generative";
}
