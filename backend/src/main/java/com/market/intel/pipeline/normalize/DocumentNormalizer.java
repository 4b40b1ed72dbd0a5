package com.market.intel.pipeline.normalize;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.model.CleanedDocument;
import com.market.intel.pipeline.model.ExtractedRecord;
import com.market.intel.pipeline.model.PageCapture;
import com.market.intel.pipeline.util.HashUtils;
import com.market.intel.pipeline.util.UrlNormalizer;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Service
public class DocumentNormalizer {
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final TextCleaner cleaner;
    private final LanguageDetector languageDetector;
    private final int minContentLength;

    public DocumentNormalizer(PipelineProperties properties, TextCleaner cleaner, LanguageDetector languageDetector) {
        this.cleaner = cleaner;
        this.languageDetector = languageDetector;
        this.minContentLength = properties.getNormalization().getMinContentLength();
    }

    /**
     * Cleans one extracted record. Empty when nothing usable is left after cleaning.
     */
    public Optional<CleanedDocument> normalize(ExtractedRecord record) {
        String text = cleaner.clean(record.text());
        if (text.isBlank()) {
            return Optional.empty();
        }
        PageCapture capture = record.capture();
        String url = capture.finalUrl() != null ? capture.finalUrl() : capture.requestedUrl();
        return Optional.of(new CleanedDocument(
            capture.captureId(),
            capture.sourceId(),
            capture.sourceUrl(),
            url,
            capture.category(),
            capture.sourceIndex(),
            capture.pageIndex(),
            UrlNormalizer.domainKey(url != null ? url : capture.sourceUrl()),
            oneLine(record.entityName()),
            capture.fetchedAt(),
            languageDetector.detect(text),
            fingerprint(text),
            capture.live() && text.length() >= minContentLength,
            oneLine(record.title()),
            oneLine(record.description()),
            text,
            cleanSections(record.sections()),
            List.copyOf(record.emails()),
            List.copyOf(record.phones()),
            List.copyOf(record.technologies()),
            List.copyOf(record.services()),
            cleanLines(record.offers()),
            cleanLines(record.novelties())
        ));
    }

    /**
     * Applies the cleaning rules again to an already cleaned document, e.g. one read back from disk.
     */
    public CleanedDocument renormalize(CleanedDocument document) {
        String text = cleaner.clean(document.text());
        boolean live = document.live() && text.length() >= minContentLength;
        return new CleanedDocument(
            document.documentId(),
            document.sourceId(),
            document.sourceUrl(),
            document.url(),
            document.category(),
            document.sourceIndex(),
            document.pageIndex(),
            document.domain(),
            oneLine(document.entityName()),
            document.capturedAt(),
            text.isBlank() ? document.language() : languageDetector.detect(text),
            fingerprint(text),
            live,
            oneLine(document.title()),
            oneLine(document.description()),
            text,
            cleanSections(document.sections()),
            listOrEmpty(document.emails()),
            listOrEmpty(document.phones()),
            listOrEmpty(document.technologies()),
            listOrEmpty(document.services()),
            cleanLines(document.offers()),
            cleanLines(document.novelties())
        );
    }

    public static String fingerprint(String text) {
        String canonical = SPACES.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        return HashUtils.sha256Hex(canonical);
    }

    private Map<String, String> cleanSections(Map<String, String> sections) {
        Map<String, String> cleaned = new LinkedHashMap<>();
        if (sections == null) {
            return cleaned;
        }
        for (Map.Entry<String, String> entry : sections.entrySet()) {
            cleaned.put(entry.getKey(), cleaner.clean(entry.getValue()));
        }
        return cleaned;
    }

    private List<String> cleanLines(List<String> lines) {
        if (lines == null) {
            return List.of();
        }
        return lines.stream()
            .map(cleaner::clean)
            .filter(line -> !line.isBlank())
            .distinct()
            .toList();
    }

    private List<String> listOrEmpty(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    private String oneLine(String value) {
        if (value == null) {
            return "";
        }
        return SPACES.matcher(cleaner.cleanLine(value)).replaceAll(" ").trim();
    }
}
