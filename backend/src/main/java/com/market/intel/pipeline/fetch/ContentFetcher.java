package com.market.intel.pipeline.fetch;

import com.market.intel.pipeline.model.FetchStrategy;
import com.market.intel.pipeline.run.RunContext;

public interface ContentFetcher {
    FetchStrategy strategy();

    /**
     * Retrieves one page. Failures come back as an unsuccessful {@link FetchedPage}, never as exceptions.
     */
    FetchedPage fetch(String url, RunContext context);
}
