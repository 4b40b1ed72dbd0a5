package com.market.intel.pipeline.fetch;

import com.market.intel.pipeline.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks same-site links that likely lead to about/services/contact style pages.
 */
@Component
public class SectionLinkFinder {
    private static final List<String> SECTION_KEYWORDS = List.of(
        "about",
        "a-propos",
        "apropos",
        "qui-sommes-nous",
        "presentation",
        "services",
        "solutions",
        "offres",
        "expertise",
        "clients",
        "references",
        "technologies",
        "contact"
    );
    private static final List<String> SKIPPED_FRAGMENTS = List.of(
        "facebook.",
        "linkedin.",
        "twitter.",
        "instagram.",
        "youtube.",
        "privacy",
        "confidentialite",
        "cookies",
        "terms",
        "mentions-legales",
        "login",
        "signin"
    );
    private static final List<String> SKIPPED_EXTENSIONS = List.of(
        ".pdf", ".jpg", ".jpeg", ".png", ".gif", ".svg", ".zip", ".doc", ".docx", ".mp4"
    );

    public List<String> find(String html, String pageUrl, int limit) {
        if (html == null || html.isBlank() || limit <= 0) {
            return List.of();
        }
        Document document = Jsoup.parse(html, pageUrl);
        String self = UrlNormalizer.normalize(pageUrl);
        Set<String> seen = new LinkedHashSet<>();
        List<String> links = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (!isCandidate(href, pageUrl)) {
                continue;
            }
            String normalized = UrlNormalizer.normalize(href);
            if (normalized == null || normalized.equals(self) || !seen.add(normalized)) {
                continue;
            }
            links.add(normalized);
            if (links.size() >= limit) {
                break;
            }
        }
        return links;
    }

    private boolean isCandidate(String href, String pageUrl) {
        if (href == null || href.isBlank()) {
            return false;
        }
        String lower = href.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return false;
        }
        if (!UrlNormalizer.sameHost(href, pageUrl)) {
            return false;
        }
        for (String fragment : SKIPPED_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return false;
            }
        }
        String path = pathOf(lower);
        for (String extension : SKIPPED_EXTENSIONS) {
            if (path.endsWith(extension)) {
                return false;
            }
        }
        for (String keyword : SECTION_KEYWORDS) {
            if (path.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private String pathOf(String url) {
        int schemeEnd = url.indexOf("://");
        int pathStart = url.indexOf('/', schemeEnd + 3);
        if (pathStart < 0) {
            return "";
        }
        int end = url.length();
        int query = url.indexOf('?', pathStart);
        if (query >= 0) {
            end = query;
        }
        int fragment = url.indexOf('#', pathStart);
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return url.substring(pathStart, end);
    }
}
