package com.market.intel.pipeline.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stop-word lists bundled under {@code /stopwords/<lang>.txt}.
 */
public final class Stopwords {
    public static final List<String> SUPPORTED_LANGUAGES = List.of("en", "fr", "es", "de");

    private static final Map<String, Set<String>> CACHE = new ConcurrentHashMap<>();

    private Stopwords() {
    }

    public static boolean isSupported(String language) {
        return language != null && SUPPORTED_LANGUAGES.contains(language);
    }

    public static Set<String> forLanguage(String language) {
        if (!isSupported(language)) {
            return Set.of();
        }
        return CACHE.computeIfAbsent(language, Stopwords::load);
    }

    private static Set<String> load(String language) {
        String resource = "/stopwords/" + language + ".txt";
        try (InputStream in = Stopwords.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing stop-word resource " + resource);
            }
            Set<String> words = new HashSet<>();
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim().toLowerCase(Locale.ROOT);
                if (!word.isEmpty() && !word.startsWith("#")) {
                    words.add(word);
                }
            }
            return Set.copyOf(words);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }
}
