package com.market.intel.pipeline.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Uses the generative summarizer when one is configured and falls back to the extractive summary on
 * any failure or blank answer.
 */
@Primary
@Component
public class FallbackSummarizer implements Summarizer {
    private static final Logger log = LoggerFactory.getLogger(FallbackSummarizer.class);

    private final GenerativeSummarizer generative;
    private final ExtractiveSummarizer extractive;

    public FallbackSummarizer(GenerativeSummarizer generative, ExtractiveSummarizer extractive) {
        this.generative = generative;
        this.extractive = extractive;
    }

    @Override
    public Summary summarize(String text, String language, int sentenceCount) {
        if (generative.isEnabled()) {
            try {
                String generated = generative.generate(text, language, sentenceCount);
                if (generated != null && !generated.isBlank()) {
                    return new Summary(generated, Summary.GENERATIVE);
                }
                log.debug("Generative summarizer returned a blank summary, using extractive");
            } catch (IOException | RuntimeException e) {
                log.warn("Generative summarizer failed, using extractive summary", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Generative summarizer interrupted, using extractive summary");
            }
        }
        return extractive.summarize(text, language, sentenceCount);
    }
}
