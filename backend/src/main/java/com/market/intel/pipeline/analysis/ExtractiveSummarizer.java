package com.market.intel.pipeline.analysis;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores sentences by how often the document's own frequent lemmas occur in them and keeps the best
 * ones in their original order.
 */
@Component
public class ExtractiveSummarizer implements Summarizer {
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final int FREQUENT_LEMMAS = 10;
    private static final int MIN_SENTENCE_WORDS = 4;

    private final TextPreprocessor preprocessor;

    public ExtractiveSummarizer(TextPreprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    @Override
    public Summary summarize(String text, String language, int sentenceCount) {
        List<String> sentences = sentences(text);
        if (sentences.isEmpty()) {
            return new Summary("", Summary.EXTRACTIVE);
        }
        List<List<String>> sentenceLemmas = new ArrayList<>();
        Map<String, Integer> frequency = new HashMap<>();
        for (String sentence : sentences) {
            List<String> lemmas = preprocessor.lemmas(sentence, language);
            sentenceLemmas.add(lemmas);
            for (String lemma : lemmas) {
                frequency.merge(lemma, 1, Integer::sum);
            }
        }
        Set<String> frequent = new HashSet<>(frequency.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
            .limit(FREQUENT_LEMMAS)
            .map(Map.Entry::getKey)
            .toList());

        List<int[]> scored = new ArrayList<>();
        for (int i = 0; i < sentences.size(); i++) {
            int score = 0;
            for (String lemma : sentenceLemmas.get(i)) {
                if (frequent.contains(lemma)) {
                    score += frequency.get(lemma);
                }
            }
            scored.add(new int[] {i, score});
        }
        List<Integer> chosen = scored.stream()
            .sorted(Comparator.<int[]>comparingInt(entry -> entry[1]).reversed().thenComparingInt(entry -> entry[0]))
            .limit(sentenceCount)
            .map(entry -> entry[0])
            .sorted()
            .toList();
        List<String> picked = new ArrayList<>();
        for (int index : chosen) {
            picked.add(sentences.get(index));
        }
        return new Summary(String.join(" ", picked), Summary.EXTRACTIVE);
    }

    List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        List<String> shortOnes = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }
        for (String line : text.split("\\n")) {
            for (String sentence : SENTENCE_END.split(line.trim())) {
                String trimmed = sentence.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.split("\\s+").length >= MIN_SENTENCE_WORDS) {
                    sentences.add(trimmed);
                } else {
                    shortOnes.add(trimmed);
                }
            }
        }
        return sentences.isEmpty() ? shortOnes : sentences;
    }
}
