package com.market.intel.pipeline.fetch;

import com.market.intel.pipeline.http.PoliteHttpClient;
import com.market.intel.pipeline.model.FetchStrategy;
import com.market.intel.pipeline.model.HttpFetchResult;
import com.market.intel.pipeline.run.RunContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class StaticContentFetcher implements ContentFetcher {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final PoliteHttpClient httpClient;

    public StaticContentFetcher(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public FetchStrategy strategy() {
        return FetchStrategy.STATIC;
    }

    @Override
    public FetchedPage fetch(String url, RunContext context) {
        HttpFetchResult result = httpClient.get(url, HTML_ACCEPT, context);
        if (result.isSuccessful() && !isMarkup(result.contentType())) {
            result = new HttpFetchResult(
                result.requestedUrl(),
                result.finalUri(),
                result.statusCode(),
                null,
                result.contentType(),
                result.fetchedAt(),
                result.duration(),
                result.attempts(),
                "unsupported_content",
                "content type " + result.contentType()
            );
        }
        return new FetchedPage(result, FetchStrategy.STATIC, null);
    }

    private boolean isMarkup(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("html") || lower.contains("xml") || lower.startsWith("text/");
    }
}
