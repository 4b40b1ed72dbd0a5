package com.market.intel.pipeline.analysis;

import com.market.intel.pipeline.model.TermPair;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CooccurrenceCounterTest {
    private final CooccurrenceCounter counter = new CooccurrenceCounter();

    @Test
    void countsPairsAcrossDocumentsWithRepresentativeForms() {
        List<PreprocessedDocument> documents = List.of(
            document("d1", "cloud", "platform", "retail"),
            document("d2", "retail", "cloud")
        );

        List<TermPair> pairs = counter.count(documents, Map.of("platform", "platforms"));

        assertThat(pairs).containsExactly(
            new TermPair("cloud", "retail", 2),
            new TermPair("cloud", "platforms", 1),
            new TermPair("platforms", "retail", 1)
        );
    }

    @Test
    void ignoresTermsOutsideTheWindowAndSelfPairs() {
        List<TermPair> pairs = counter.count(
            List.of(document("d1", "alpha", "beta", "beta", "gamma", "delta")),
            Map.of()
        );

        assertThat(pairs).extracting(pair -> pair.first() + "+" + pair.second())
            .doesNotContain("alpha+gamma", "alpha+delta", "beta+beta")
            .contains("alpha+beta", "beta+gamma", "beta+delta", "delta+gamma");
    }

    @Test
    void emptyCorpusHasNoPairs() {
        assertThat(counter.count(List.of(), Map.of())).isEmpty();
    }

    private static PreprocessedDocument document(String id, String... lemmas) {
        return new PreprocessedDocument(id, "en", List.of(lemmas), Map.of());
    }
}
