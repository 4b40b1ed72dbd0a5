package com.market.intel.pipeline.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractiveSummarizerTest {
    private final ExtractiveSummarizer summarizer = new ExtractiveSummarizer(new TextPreprocessor());

    @Test
    void keepsMostCentralSentencesInOriginalOrder() {
        String text = "Acme builds cloud platforms for retailers.\n"
            + "The weather was nice yesterday afternoon.\n"
            + "Our cloud platforms help retailers scale quickly.\n"
            + "Contact the cloud team for platforms pricing.";

        Summary summary = summarizer.summarize(text, "en", 2);

        assertThat(summary.method()).isEqualTo(Summary.EXTRACTIVE);
        assertThat(summary.text())
            .isEqualTo("Acme builds cloud platforms for retailers. Our cloud platforms help retailers scale quickly.");
    }

    @Test
    void shortTextIsReturnedWhole() {
        Summary summary = summarizer.summarize("Cloud consulting.", "en", 3);

        assertThat(summary.text()).isEqualTo("Cloud consulting.");
    }

    @Test
    void emptyTextGivesEmptySummary() {
        assertThat(summarizer.summarize("  ", "en", 3).text()).isEmpty();
    }
}
