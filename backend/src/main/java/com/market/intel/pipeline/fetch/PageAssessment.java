package com.market.intel.pipeline.fetch;

public record PageAssessment(
    int textLength,
    int scriptCount,
    int externalScriptCount,
    boolean spaMarker,
    boolean scriptHeavyHost,
    boolean antiBotChallenge
) {
    /**
     * True when the static markup is unlikely to carry the page's real content.
     */
    public boolean looksEmpty(int minTextLength) {
        if (textLength < minTextLength || antiBotChallenge || scriptHeavyHost) {
            return true;
        }
        boolean thin = textLength < minTextLength * 3;
        if (thin && spaMarker) {
            return true;
        }
        return thin && (scriptCount > 25 || externalScriptCount > 10);
    }
}
