package com.market.intel.pipeline.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class HeadingSynonymMatcher implements SectionMatcher {
    private static final String HEADING_SELECTOR = "h1, h2, h3, h4, h5, h6, dt, [role=heading], p > strong:only-child";

    @Override
    public Optional<String> match(Document document, String label, SectionDictionary dictionary, int maxChars) {
        for (Element heading : document.select(HEADING_SELECTOR)) {
            if (!dictionary.headingMatches(label, heading.text())) {
                continue;
            }
            Element anchor = "strong".equals(heading.normalName()) ? heading.parent() : heading;
            String body = collectFollowing(anchor, maxChars);
            if (body.isBlank() && anchor.parent() != null && anchor.siblingElements().isEmpty()) {
                body = collectFollowing(anchor.parent(), maxChars);
            }
            if (!body.isBlank()) {
                return Optional.of(SectionText.truncate(body, maxChars));
            }
        }
        return Optional.empty();
    }

    private String collectFollowing(Element anchor, int maxChars) {
        int level = SectionText.headingLevel(anchor);
        List<String> parts = new ArrayList<>();
        int length = 0;
        Element sibling = anchor.nextElementSibling();
        while (sibling != null && length < maxChars) {
            if (SectionText.isHeading(sibling) && SectionText.headingLevel(sibling) <= level) {
                break;
            }
            String text = SectionText.text(sibling);
            if (!text.isBlank()) {
                parts.add(text);
                length += text.length();
            }
            sibling = sibling.nextElementSibling();
        }
        return String.join("\n", parts).trim();
    }
}
