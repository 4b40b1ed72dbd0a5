package com.market.intel.pipeline.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Optional;

/**
 * Matches containers whose id or class names the section, e.g. {@code <section id="services">}.
 */
public class AnchorMatcher implements SectionMatcher {
    private static final int MIN_TEXT_LENGTH = 40;

    @Override
    public Optional<String> match(Document document, String label, SectionDictionary dictionary, int maxChars) {
        for (Element element : document.select("section, article, div, aside, footer")) {
            if (!namesSection(element, label, dictionary)) {
                continue;
            }
            if (!SectionDictionary.CONTACT.equals(label) && element.closest("nav, header, footer") != null) {
                continue;
            }
            String text = SectionText.text(element);
            if (text.length() >= MIN_TEXT_LENGTH) {
                return Optional.of(SectionText.truncate(text, maxChars));
            }
        }
        return Optional.empty();
    }

    private boolean namesSection(Element element, String label, SectionDictionary dictionary) {
        String id = element.id().toLowerCase(Locale.ROOT);
        String classes = element.className().toLowerCase(Locale.ROOT);
        if (id.isEmpty() && classes.isEmpty()) {
            return false;
        }
        for (String keyword : dictionary.anchorKeywords(label)) {
            if (id.contains(keyword) || classes.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
