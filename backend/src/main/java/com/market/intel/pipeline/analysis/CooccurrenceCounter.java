package com.market.intel.pipeline.analysis;

import com.market.intel.pipeline.model.TermPair;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class CooccurrenceCounter {
    static final int WINDOW = 2;
    static final int VOCABULARY_SIZE = 30;
    static final int MAX_PAIRS = 20;

    public List<TermPair> count(Collection<PreprocessedDocument> documents, Map<String, String> representativeForms) {
        Map<String, Integer> frequency = new HashMap<>();
        for (PreprocessedDocument document : documents) {
            for (String lemma : document.lemmas()) {
                frequency.merge(lemma, 1, Integer::sum);
            }
        }
        Set<String> vocabulary = frequency.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
            .limit(VOCABULARY_SIZE)
            .map(Map.Entry::getKey)
            .collect(Collectors.toSet());

        Map<List<String>, Integer> pairs = new HashMap<>();
        for (PreprocessedDocument document : documents) {
            List<String> lemmas = document.lemmas();
            for (int i = 0; i < lemmas.size(); i++) {
                String left = lemmas.get(i);
                if (!vocabulary.contains(left)) {
                    continue;
                }
                for (int j = i + 1; j <= Math.min(lemmas.size() - 1, i + WINDOW); j++) {
                    String right = lemmas.get(j);
                    if (right.equals(left) || !vocabulary.contains(right)) {
                        continue;
                    }
                    String first = representativeForms.getOrDefault(left, left);
                    String second = representativeForms.getOrDefault(right, right);
                    List<String> key = first.compareTo(second) <= 0 ? List.of(first, second) : List.of(second, first);
                    pairs.merge(key, 1, Integer::sum);
                }
            }
        }
        return pairs.entrySet().stream()
            .map(entry -> new TermPair(entry.getKey().get(0), entry.getKey().get(1), entry.getValue()))
            .sorted(Comparator.comparingInt(TermPair::count).reversed()
                .thenComparing(TermPair::first)
                .thenComparing(TermPair::second))
            .limit(MAX_PAIRS)
            .toList();
    }
}
