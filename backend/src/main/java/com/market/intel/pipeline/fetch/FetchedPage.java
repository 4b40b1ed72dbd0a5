package com.market.intel.pipeline.fetch;

import com.market.intel.pipeline.model.FetchStrategy;
import com.market.intel.pipeline.model.HttpFetchResult;

public record FetchedPage(HttpFetchResult result, FetchStrategy strategy, String snapshotPath) {
    public boolean isSuccessful() {
        return result != null && result.isSuccessful() && result.body() != null && !result.body().isBlank();
    }
}
