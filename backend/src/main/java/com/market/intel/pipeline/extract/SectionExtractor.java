package com.market.intel.pipeline.extract;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.model.ExtractedRecord;
import com.market.intel.pipeline.model.PageCapture;
import com.market.intel.pipeline.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Service
public class SectionExtractor {
    private static final Logger log = LoggerFactory.getLogger(SectionExtractor.class);

    public static final String FIELD_NAME = "entityName";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_DESCRIPTION = "description";
    public static final String FIELD_EMAILS = "emails";
    public static final String FIELD_PHONES = "phones";
    public static final String FIELD_TECHNOLOGIES = "technologyMentions";
    public static final String FIELD_SERVICES = "serviceMentions";
    public static final String FIELD_OFFERS = "offers";
    public static final String FIELD_NOVELTIES = "novelties";

    private static final String NOISE_SELECTOR = "script, style, noscript, template, svg, iframe, object, canvas";
    private static final String CHROME_SELECTOR = "nav, header, footer, form, aside, [role=navigation], [aria-hidden=true]";
    private static final Pattern TITLE_SEPARATOR = Pattern.compile("\\s+[|\\-–—:·•]\\s+");

    private final PipelineProperties.Extraction properties;
    private final SectionDictionary dictionary;
    private final List<SectionMatcher> matchers;
    private final MentionCatalog technologyCatalog;
    private final MentionCatalog serviceCatalog;

    public SectionExtractor(PipelineProperties properties) {
        this.properties = properties.getExtraction();
        this.dictionary = SectionDictionary.defaults();
        this.matchers = List.of(new HeadingSynonymMatcher(), new AnchorMatcher(), new ProximityFallbackMatcher());
        this.technologyCatalog = MentionCatalog.technologies();
        this.serviceCatalog = MentionCatalog.services();
    }

    public ExtractedRecord extract(PageCapture capture) {
        if (capture.html() == null || capture.html().isBlank()) {
            return empty(capture);
        }
        try {
            return parse(capture);
        } catch (RuntimeException e) {
            log.warn("Extraction failed for capture {} ({})", capture.captureId(), capture.finalUrl(), e);
            return empty(capture);
        }
    }

    private ExtractedRecord parse(PageCapture capture) {
        String baseUrl = capture.finalUrl() == null ? "" : capture.finalUrl();
        Document document = Jsoup.parse(capture.html(), baseUrl);
        document.select(NOISE_SELECTOR).remove();

        Map<String, Boolean> confidence = new LinkedHashMap<>();
        String fullText = SectionText.text(document.body());

        String title = document.title().trim();
        confidence.put(FIELD_TITLE, !title.isEmpty());
        String description = metaContent(document, "meta[name=description]", "meta[property=og:description]");
        confidence.put(FIELD_DESCRIPTION, !description.isEmpty());
        Optional<String> name = resolveName(document, capture, title);
        confidence.put(FIELD_NAME, name.isPresent());

        int maxChars = properties.getMaxSectionChars();
        Map<String, String> sections = new LinkedHashMap<>();
        for (String label : dictionary.labels()) {
            Optional<String> section = Optional.empty();
            for (SectionMatcher matcher : matchers) {
                section = matcher.match(document, label, dictionary, maxChars);
                if (section.isPresent()) {
                    break;
                }
            }
            sections.put(label, section.orElse(""));
            confidence.put(label, section.isPresent());
        }

        Document content = document.clone();
        content.select(CHROME_SELECTOR).remove();
        List<String> contentLines = SectionText.lines(content.body());
        if (contentLines.isEmpty()) {
            contentLines = SectionText.lines(document.body());
        }
        String text = String.join("\n", contentLines);

        List<String> emails = ContactPatterns.emails(document, fullText);
        List<String> phones = ContactPatterns.phones(document, fullText);
        List<String> technologies = technologyCatalog.find(fullText);
        List<String> services = serviceCatalog.find(text + "\n" + sections.get(SectionDictionary.SERVICES));
        int snippetLimit = properties.getMaxSnippets();
        List<String> offers = SnippetDetector.offers(contentLines, snippetLimit);
        List<String> novelties = SnippetDetector.novelties(contentLines, snippetLimit);
        confidence.put(FIELD_EMAILS, !emails.isEmpty());
        confidence.put(FIELD_PHONES, !phones.isEmpty());
        confidence.put(FIELD_TECHNOLOGIES, !technologies.isEmpty());
        confidence.put(FIELD_SERVICES, !services.isEmpty());
        confidence.put(FIELD_OFFERS, !offers.isEmpty());
        confidence.put(FIELD_NOVELTIES, !novelties.isEmpty());

        return new ExtractedRecord(
            capture,
            name.orElseGet(() -> fallbackName(capture)),
            title,
            description,
            sections,
            emails,
            phones,
            technologies,
            services,
            offers,
            novelties,
            text,
            confidence
        );
    }

    private Optional<String> resolveName(Document document, PageCapture capture, String title) {
        if (capture.sourceName() != null && !capture.sourceName().isBlank()) {
            return Optional.of(capture.sourceName().trim());
        }
        String siteName = metaContent(document, "meta[property=og:site_name]");
        if (!siteName.isEmpty()) {
            return Optional.of(siteName);
        }
        if (title.isEmpty()) {
            return Optional.empty();
        }
        String[] segments = TITLE_SEPARATOR.split(title);
        if (segments.length == 1) {
            return Optional.of(segments[0].trim());
        }
        String hostLabel = hostLabel(capture.finalUrl());
        String shortest = null;
        for (String segment : segments) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String compact = SectionDictionary.normalize(trimmed).replace(" ", "");
            if (hostLabel != null && !compact.isEmpty() && (hostLabel.contains(compact) || compact.contains(hostLabel))) {
                return Optional.of(trimmed);
            }
            if (shortest == null || trimmed.length() < shortest.length()) {
                shortest = trimmed;
            }
        }
        return Optional.ofNullable(shortest);
    }

    private String fallbackName(PageCapture capture) {
        String domain = UrlNormalizer.domainKey(capture.finalUrl() != null ? capture.finalUrl() : capture.sourceUrl());
        return domain == null ? "" : domain;
    }

    private String hostLabel(String url) {
        String domain = UrlNormalizer.domainKey(url);
        if (domain == null) {
            return null;
        }
        int dot = domain.indexOf('.');
        String label = dot > 0 ? domain.substring(0, dot) : domain;
        return label.replace("-", "").toLowerCase(Locale.ROOT);
    }

    private String metaContent(Document document, String... selectors) {
        for (String selector : selectors) {
            Element meta = document.selectFirst(selector);
            if (meta != null && !meta.attr("content").isBlank()) {
                return meta.attr("content").trim();
            }
        }
        return "";
    }

    private ExtractedRecord empty(PageCapture capture) {
        Map<String, Boolean> confidence = new LinkedHashMap<>();
        confidence.put(FIELD_NAME, false);
        confidence.put(FIELD_TITLE, false);
        confidence.put(FIELD_DESCRIPTION, false);
        Map<String, String> sections = new LinkedHashMap<>();
        for (String label : dictionary.labels()) {
            sections.put(label, "");
            confidence.put(label, false);
        }
        for (String field : List.of(FIELD_EMAILS, FIELD_PHONES, FIELD_TECHNOLOGIES, FIELD_SERVICES, FIELD_OFFERS, FIELD_NOVELTIES)) {
            confidence.put(field, false);
        }
        return new ExtractedRecord(
            capture,
            fallbackName(capture),
            "",
            "",
            sections,
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            "",
            confidence
        );
    }
}
