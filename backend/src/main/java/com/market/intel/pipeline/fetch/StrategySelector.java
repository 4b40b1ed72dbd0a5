package com.market.intel.pipeline.fetch;

import com.market.intel.pipeline.model.FetchStrategy;
import com.market.intel.pipeline.model.HttpFetchResult;
import com.market.intel.pipeline.model.SourceStrategy;

/**
 * Pure strategy decisions: explicit hints win, {@code AUTO} starts static and escalates on thin pages.
 */
public final class StrategySelector {
    private StrategySelector() {
    }

    public static FetchStrategy initial(SourceStrategy hint) {
        return hint == SourceStrategy.DYNAMIC ? FetchStrategy.DYNAMIC : FetchStrategy.STATIC;
    }

    public static boolean shouldEscalate(
        SourceStrategy hint,
        HttpFetchResult staticResult,
        PageAssessment assessment,
        int minTextLength
    ) {
        if (hint != SourceStrategy.AUTO || staticResult == null) {
            return false;
        }
        if (staticResult.isSuccessful()) {
            return assessment != null && assessment.looksEmpty(minTextLength);
        }
        int status = staticResult.statusCode();
        return (status == 401 || status == 403 || status == 503)
            && assessment != null
            && assessment.antiBotChallenge();
    }

    public static boolean shouldFallBackToStatic(SourceStrategy hint, HttpFetchResult renderedResult) {
        if (hint != SourceStrategy.DYNAMIC || renderedResult == null || renderedResult.isSuccessful()) {
            return false;
        }
        return !"invalid_url".equals(renderedResult.errorCode()) && !"cancelled".equals(renderedResult.errorCode());
    }
}
