package com.market.intel.pipeline.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Block-aware text extraction: keeps one line per block element instead of jsoup's flattened text.
 */
final class SectionText {
    private static final String BLOCK_SELECTOR =
        "p, div, li, h1, h2, h3, h4, h5, h6, br, tr, section, article, header, footer, dt, dd, blockquote, address, figcaption";
    private static final Pattern SPACES = Pattern.compile("[\\s\\u00A0]+");

    private SectionText() {
    }

    static List<String> lines(Element root) {
        if (root == null) {
            return List.of();
        }
        Element copy = root.clone();
        for (Element block : copy.select(BLOCK_SELECTOR)) {
            block.after(new TextNode("\n"));
        }
        List<String> lines = new ArrayList<>();
        for (String raw : copy.wholeText().split("\n")) {
            String line = SPACES.matcher(raw).replaceAll(" ").trim();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    static String text(Element root) {
        return String.join("\n", lines(root));
    }

    static String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        int cut = value.lastIndexOf(' ', maxChars);
        return value.substring(0, cut > maxChars / 2 ? cut : maxChars).trim();
    }

    static int headingLevel(Element element) {
        String tag = element.normalName();
        if (tag.length() == 2 && tag.charAt(0) == 'h' && Character.isDigit(tag.charAt(1))) {
            return tag.charAt(1) - '0';
        }
        return 7;
    }

    static boolean isHeading(Element element) {
        return headingLevel(element) < 7 || "dt".equals(element.normalName());
    }
}
