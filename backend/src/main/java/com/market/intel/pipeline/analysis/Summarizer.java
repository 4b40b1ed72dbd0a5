package com.market.intel.pipeline.analysis;

public interface Summarizer {
    Summary summarize(String text, String language, int sentenceCount);
}
