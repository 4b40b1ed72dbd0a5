package com.market.intel.pipeline.fetch;

import com.market.intel.pipeline.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;

public final class ShellDetector {
    private static final int MIN_MARKUP_LENGTH = 100;
    private static final List<String> SCRIPT_HEAVY_HOSTS = List.of(
        "upwork.com",
        "malt.fr",
        "fiverr.com",
        "freelancer.com",
        "toptal.com",
        "peopleperhour.com",
        "guru.com",
        "producthunt.com"
    );
    private static final List<String> SPA_MARKERS = List.of(
        "data-reactroot",
        "__next_data__",
        "react-refresh",
        "ng-version",
        "data-v-app",
        "__nuxt",
        "window.__initial_state__"
    );
    private static final List<String> ANTI_BOT_MARKERS = List.of(
        "cloudflare",
        "captcha",
        "verify you are human",
        "attention required",
        "checking your browser"
    );

    private ShellDetector() {
    }

    public static PageAssessment assess(String html, String url) {
        boolean heavyHost = isScriptHeavyHost(url);
        if (html == null || html.trim().length() < MIN_MARKUP_LENGTH) {
            return new PageAssessment(0, 0, 0, false, heavyHost, false);
        }
        Document document = Jsoup.parse(html, url == null ? "" : url);
        int scripts = 0;
        int externalScripts = 0;
        for (Element script : document.select("script")) {
            scripts++;
            if (script.hasAttr("src")) {
                externalScripts++;
            }
        }
        String lowerHtml = html.toLowerCase(Locale.ROOT);
        boolean spaMarker = SPA_MARKERS.stream().anyMatch(lowerHtml::contains)
            || !document.select("body > div#root:empty, body > div#app:empty, body > div#__next:empty").isEmpty();
        String text = visibleText(document);
        String lowerText = text.toLowerCase(Locale.ROOT);
        boolean antiBot = text.length() < 2000 && ANTI_BOT_MARKERS.stream().anyMatch(lowerText::contains);
        return new PageAssessment(text.length(), scripts, externalScripts, spaMarker, heavyHost, antiBot);
    }

    public static String visibleText(Document document) {
        Document copy = document.clone();
        copy.select("script, style, noscript, template, svg").remove();
        Element body = copy.body();
        return body == null ? "" : body.text().trim();
    }

    static boolean isScriptHeavyHost(String url) {
        String host = UrlNormalizer.host(url);
        if (host == null) {
            return false;
        }
        for (String candidate : SCRIPT_HEAVY_HOSTS) {
            if (host.equals(candidate) || host.endsWith("." + candidate)) {
                return true;
            }
        }
        return false;
    }
}
