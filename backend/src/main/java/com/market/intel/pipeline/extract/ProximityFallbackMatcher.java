package com.market.intel.pipeline.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.Optional;

/**
 * Last resort for the about section: first substantial paragraph after the main title, then the meta description.
 */
public class ProximityFallbackMatcher implements SectionMatcher {
    private static final int MIN_PARAGRAPH_LENGTH = 60;

    @Override
    public Optional<String> match(Document document, String label, SectionDictionary dictionary, int maxChars) {
        if (!SectionDictionary.ABOUT.equals(label)) {
            return Optional.empty();
        }
        Elements all = document.getAllElements();
        Element title = document.selectFirst("h1");
        int start = title == null ? 0 : all.indexOf(title);
        for (int i = Math.max(0, start); i < all.size(); i++) {
            Element element = all.get(i);
            if (!"p".equals(element.normalName()) || element.closest("nav, header, footer, form") != null) {
                continue;
            }
            String text = element.text().trim();
            if (text.length() >= MIN_PARAGRAPH_LENGTH) {
                return Optional.of(SectionText.truncate(text, maxChars));
            }
        }
        Element meta = document.selectFirst("meta[name=description], meta[property=og:description]");
        if (meta != null && !meta.attr("content").isBlank()) {
            return Optional.of(SectionText.truncate(meta.attr("content").trim(), maxChars));
        }
        return Optional.empty();
    }
}
