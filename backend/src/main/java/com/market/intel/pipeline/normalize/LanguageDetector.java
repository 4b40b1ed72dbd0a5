package com.market.intel.pipeline.normalize;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.util.Stopwords;
import opennlp.tools.langdetect.Language;
import opennlp.tools.langdetect.LanguageDetectorME;
import opennlp.tools.langdetect.LanguageDetectorModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stop-word profile scoring over the bundled languages. When an OpenNLP language-detector model is
 * configured, confident model predictions take precedence.
 */
@Component
public class LanguageDetector {
    private static final Logger log = LoggerFactory.getLogger(LanguageDetector.class);
    private static final Pattern WORD = Pattern.compile("\\p{L}+");
    private static final double MIN_MODEL_CONFIDENCE = 0.5;
    private static final Map<String, String> ISO3_TO_ISO1 = Map.of(
        "eng", "en",
        "fra", "fr",
        "spa", "es",
        "deu", "de",
        "ita", "it",
        "por", "pt",
        "nld", "nl"
    );

    private final String defaultLanguage;
    private final LanguageDetectorME modelDetector;

    public LanguageDetector(PipelineProperties properties) {
        this.defaultLanguage = properties.getNormalization().getDefaultLanguage();
        this.modelDetector = loadModel(properties.getNormalization().getLanguageModelPath());
    }

    public String detect(String text) {
        if (text == null || text.isBlank()) {
            return defaultLanguage;
        }
        if (modelDetector != null) {
            Language best = modelDetector.predictLanguage(text);
            if (best != null && best.getConfidence() >= MIN_MODEL_CONFIDENCE) {
                return ISO3_TO_ISO1.getOrDefault(best.getLang(), best.getLang());
            }
        }
        return detectByProfile(text);
    }

    String detectByProfile(String text) {
        int[] hits = new int[Stopwords.SUPPORTED_LANGUAGES.size()];
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            for (int i = 0; i < hits.length; i++) {
                if (Stopwords.forLanguage(Stopwords.SUPPORTED_LANGUAGES.get(i)).contains(word)) {
                    hits[i]++;
                }
            }
        }
        String best = defaultLanguage;
        int bestHits = 0;
        for (int i = 0; i < hits.length; i++) {
            String language = Stopwords.SUPPORTED_LANGUAGES.get(i);
            if (hits[i] > bestHits || (hits[i] == bestHits && hits[i] > 0 && language.equals(defaultLanguage))) {
                best = language;
                bestHits = hits[i];
            }
        }
        return best;
    }

    private LanguageDetectorME loadModel(String modelPath) {
        if (modelPath == null || modelPath.isBlank()) {
            return null;
        }
        Path path = Paths.get(modelPath);
        try (InputStream in = Files.newInputStream(path)) {
            log.info("Loading language detector model from {}", path);
            return new LanguageDetectorME(new LanguageDetectorModel(in));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load language detector model " + path, e);
        }
    }
}
