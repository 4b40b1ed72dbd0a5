package com.market.intel.pipeline.normalize;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Line-oriented noise removal. {@code clean(clean(x))} equals {@code clean(x)}.
 */
@Component
public class TextCleaner {
    private static final Map<String, String> SUBSTITUTIONS = new LinkedHashMap<>();
    private static final List<String> BOILERPLATE = List.of(
        "accept cookies",
        "accepter les cookies",
        "we use cookies",
        "nous utilisons des cookies",
        "cookie policy",
        "politique de cookies",
        "all rights reserved",
        "tous droits reserves",
        "privacy policy",
        "politique de confidentialite",
        "terms and conditions",
        "conditions generales",
        "mentions legales",
        "learn more",
        "read more",
        "en savoir plus",
        "voir plus",
        "lire la suite",
        "back to top",
        "retour en haut",
        "skip to content",
        "aller au contenu",
        "subscribe to our newsletter",
        "inscrivez-vous a notre newsletter"
    );
    private static final int BOILERPLATE_SLACK = 60;
    private static final Pattern TAG = Pattern.compile("<[^<>]{1,200}>");
    private static final Pattern URL = Pattern.compile("(?:https?://|www\\.)\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CODE_LITERAL = Pattern.compile("(?<![\\p{L}\\p{N}])(?:undefined|null|NaN)(?![\\p{L}\\p{N}])");
    private static final Pattern SPACES = Pattern.compile("[\\s\\u00A0\\u200B]+");
    private static final Pattern HAS_WORD = Pattern.compile("[\\p{L}\\p{N}]");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final int MIN_LINE_LENGTH = 3;
    private static final int REPETITION_MIN_WORDS = 4;
    private static final double REPETITION_MIN_UNIQUE_RATIO = 0.35;
    private static final int MAX_LINE_PASSES = 5;

    static {
        SUBSTITUTIONS.put("’", "'");
        SUBSTITUTIONS.put("‘", "'");
        SUBSTITUTIONS.put("“", "\"");
        SUBSTITUTIONS.put("”", "\"");
        SUBSTITUTIONS.put("«", "\"");
        SUBSTITUTIONS.put("»", "\"");
        SUBSTITUTIONS.put("–", "-");
        SUBSTITUTIONS.put("—", "-");
        SUBSTITUTIONS.put("…", "...");
        SUBSTITUTIONS.put("•", "-");
        SUBSTITUTIONS.put("™", "(TM)");
        SUBSTITUTIONS.put("®", "(R)");
        SUBSTITUTIONS.put("©", "(C)");
        SUBSTITUTIONS.put("€", "EUR");
        SUBSTITUTIONS.put("→", "->");
    }

    public String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String line : raw.split("\\r?\\n")) {
            String cleaned = cleanLine(line);
            if (!keep(cleaned)) {
                continue;
            }
            if (seen.add(cleaned.toLowerCase(Locale.ROOT))) {
                kept.add(cleaned);
            }
        }
        return String.join("\n", kept);
    }

    String cleanLine(String line) {
        String current = line;
        for (int pass = 0; pass < MAX_LINE_PASSES; pass++) {
            String next = cleanLineOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    private String cleanLineOnce(String line) {
        String value = line;
        for (Map.Entry<String, String> substitution : SUBSTITUTIONS.entrySet()) {
            value = value.replace(substitution.getKey(), substitution.getValue());
        }
        value = Normalizer.normalize(value, Normalizer.Form.NFKC);
        value = TAG.matcher(value).replaceAll(" ");
        value = URL.matcher(value).replaceAll(" ");
        value = CODE_LITERAL.matcher(value).replaceAll(" ");
        return SPACES.matcher(value).replaceAll(" ").trim();
    }

    boolean keep(String line) {
        if (line.length() < MIN_LINE_LENGTH || !HAS_WORD.matcher(line).find()) {
            return false;
        }
        return !isBoilerplate(line) && !isRepetitive(line);
    }

    private boolean isBoilerplate(String line) {
        String folded = fold(line);
        for (String phrase : BOILERPLATE) {
            if (folded.contains(phrase) && folded.length() <= phrase.length() + BOILERPLATE_SLACK) {
                return true;
            }
        }
        return false;
    }

    private boolean isRepetitive(String line) {
        String[] words = line.toLowerCase(Locale.ROOT).split(" ");
        if (words.length < REPETITION_MIN_WORDS) {
            return false;
        }
        Set<String> unique = new HashSet<>(List.of(words));
        return (double) unique.size() / words.length < REPETITION_MIN_UNIQUE_RATIO;
    }

    private String fold(String value) {
        String decomposed = Normalizer.normalize(value.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("");
    }
}
