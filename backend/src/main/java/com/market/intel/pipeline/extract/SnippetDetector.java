package com.market.intel.pipeline.extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks short lines announcing commercial offers or novelties.
 */
public final class SnippetDetector {
    private static final int MIN_LINE_LENGTH = 15;
    private static final int MAX_LINE_LENGTH = 300;
    private static final Pattern OFFER = Pattern.compile(
        "(?<![\\p{L}])(?:offres?|offers?|pricing|tarifs?|forfaits?|devis|quotes?|abonnements?|subscriptions?|formules?|packs?)(?![\\p{L}])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern NOVELTY = Pattern.compile(
        "(?<![\\p{L}])(?:nouveaut\\p{L}*|nouveaux?|nouvelles?|new|launch\\p{L}*|lancements?|releases?|updates?|mise à jour"
            + "|promotions?|promos?|événements?|evenements?|events?|webinars?)(?![\\p{L}])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    private SnippetDetector() {
    }

    public static List<String> offers(List<String> lines, int limit) {
        return collect(lines, OFFER, limit);
    }

    public static List<String> novelties(List<String> lines, int limit) {
        return collect(lines, NOVELTY, limit);
    }

    private static List<String> collect(List<String> lines, Pattern pattern, int limit) {
        Set<String> found = new LinkedHashSet<>();
        for (String line : lines) {
            if (found.size() >= limit) {
                break;
            }
            if (line.length() < MIN_LINE_LENGTH || line.length() > MAX_LINE_LENGTH) {
                continue;
            }
            if (pattern.matcher(line).find()) {
                found.add(line);
            }
        }
        return new ArrayList<>(found);
    }
}
