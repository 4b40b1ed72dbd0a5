package com.market.intel.pipeline.analysis;

import opennlp.tools.stemmer.snowball.SnowballStemmer;

/**
 * Snowball stemming per language. Stemmer instances are stateful, so each call site gets its own.
 */
public final class Lemmatizer {
    private final SnowballStemmer stemmer;

    private Lemmatizer(SnowballStemmer stemmer) {
        this.stemmer = stemmer;
    }

    public static Lemmatizer forLanguage(String language) {
        SnowballStemmer.ALGORITHM algorithm = switch (language == null ? "" : language) {
            case "en" -> SnowballStemmer.ALGORITHM.ENGLISH;
            case "fr" -> SnowballStemmer.ALGORITHM.FRENCH;
            case "es" -> SnowballStemmer.ALGORITHM.SPANISH;
            case "de" -> SnowballStemmer.ALGORITHM.GERMAN;
            default -> throw new UnsupportedLanguageException(language);
        };
        return new Lemmatizer(new SnowballStemmer(algorithm));
    }

    public String lemma(String token) {
        CharSequence stem = stemmer.stem(token);
        return stem == null || stem.length() == 0 ? token : stem.toString();
    }
}
