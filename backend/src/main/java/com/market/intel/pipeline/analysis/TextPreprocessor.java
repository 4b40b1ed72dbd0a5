package com.market.intel.pipeline.analysis;

import com.market.intel.pipeline.util.Stopwords;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class TextPreprocessor {
    private static final Pattern WORD = Pattern.compile("\\p{L}+");
    private static final int MIN_TOKEN_LENGTH = 3;

    public PreprocessedDocument preprocess(String documentId, String text, String language) {
        Lemmatizer lemmatizer = Lemmatizer.forLanguage(language);
        Set<String> stopwords = stopwordsFor(language);
        List<String> lemmas = new ArrayList<>();
        Map<String, Map<String, Integer>> surfaceForms = new TreeMap<>();
        for (String token : tokens(text, stopwords)) {
            String lemma = lemmatizer.lemma(token);
            lemmas.add(lemma);
            surfaceForms.computeIfAbsent(lemma, ignored -> new TreeMap<>()).merge(token, 1, Integer::sum);
        }
        return new PreprocessedDocument(documentId, language, lemmas, surfaceForms);
    }

    public List<String> lemmas(String text, String language) {
        Lemmatizer lemmatizer = Lemmatizer.forLanguage(language);
        List<String> lemmas = new ArrayList<>();
        for (String token : tokens(text, stopwordsFor(language))) {
            lemmas.add(lemmatizer.lemma(token));
        }
        return lemmas;
    }

    List<String> tokens(String text, Set<String> stopwords) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= MIN_TOKEN_LENGTH && !stopwords.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private Set<String> stopwordsFor(String language) {
        if (!Stopwords.isSupported(language)) {
            throw new UnsupportedLanguageException(language);
        }
        Set<String> combined = new HashSet<>(Stopwords.forLanguage(language));
        combined.addAll(Stopwords.forLanguage("en"));
        combined.addAll(Stopwords.forLanguage("fr"));
        return combined;
    }
}
