package com.market.intel.pipeline.analysis;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Corpus-wide TF-IDF. The document-frequency table and representative surface forms are built once,
 * after the corpus is closed, and only read afterwards.
 */
@Component
public class TfIdfCalculator {
    private static final Comparator<ScoredTerm> RANKING = Comparator
        .comparingDouble(ScoredTerm::score)
        .reversed()
        .thenComparing(ScoredTerm::term);

    public Map<String, Integer> documentFrequency(Collection<PreprocessedDocument> documents) {
        Map<String, Integer> frequency = new HashMap<>();
        for (PreprocessedDocument document : documents) {
            for (String lemma : new HashSet<>(document.lemmas())) {
                frequency.merge(lemma, 1, Integer::sum);
            }
        }
        return frequency;
    }

    /**
     * Most frequent surface token per lemma across the corpus, ties to the lexicographically smallest.
     */
    public Map<String, String> representativeForms(Collection<PreprocessedDocument> documents) {
        Map<String, Map<String, Integer>> totals = new TreeMap<>();
        for (PreprocessedDocument document : documents) {
            document.surfaceForms().forEach((lemma, forms) -> {
                Map<String, Integer> lemmaTotals = totals.computeIfAbsent(lemma, ignored -> new TreeMap<>());
                forms.forEach((form, count) -> lemmaTotals.merge(form, count, Integer::sum));
            });
        }
        Map<String, String> representatives = new HashMap<>();
        totals.forEach((lemma, forms) -> {
            String best = null;
            int bestCount = -1;
            for (Map.Entry<String, Integer> entry : forms.entrySet()) {
                if (entry.getValue() > bestCount) {
                    best = entry.getKey();
                    bestCount = entry.getValue();
                }
            }
            representatives.put(lemma, best);
        });
        return representatives;
    }

    public List<ScoredTerm> rank(
        PreprocessedDocument document,
        Map<String, Integer> documentFrequency,
        int corpusSize,
        Map<String, String> representativeForms,
        int limit
    ) {
        List<String> lemmas = document.lemmas();
        if (lemmas.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> counts = new TreeMap<>();
        for (String lemma : lemmas) {
            counts.merge(lemma, 1, Integer::sum);
        }
        double total = lemmas.size();
        List<ScoredTerm> scored = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            String lemma = entry.getKey();
            double tf = entry.getValue() / total;
            double idf = idf(documentFrequency.getOrDefault(lemma, 0), corpusSize);
            String term = representativeForms.getOrDefault(lemma, lemma);
            scored.add(new ScoredTerm(lemma, term, tf * idf));
        }
        scored.sort(RANKING);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : List.copyOf(scored);
    }

    static double idf(int documentFrequency, int corpusSize) {
        return Math.log((1.0 + corpusSize) / (1.0 + documentFrequency)) + 1.0;
    }
}
