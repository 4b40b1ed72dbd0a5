package com.market.intel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "market-intel/0.1 (+contact)";

    private Fetch fetch = new Fetch();
    private Browser browser = new Browser();
    private Extraction extraction = new Extraction();
    private Normalization normalization = new Normalization();
    private Analysis analysis = new Analysis();
    private Aggregation aggregation = new Aggregation();
    private Cli cli = new Cli();

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public void setNormalization(Normalization normalization) {
        this.normalization = normalization;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Fetch {
        private String userAgent;
        private int perHostDelayMs = 1000;
        private int globalConcurrency = 5;
        private int requestTimeoutSeconds = 20;
        private int requestMaxRetries = 2;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 8000;
        private int staticMinTextLength = 300;
        private int maxSectionLinks = 3;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getRequestMaxRetries() {
            return Math.max(0, requestMaxRetries);
        }

        public void setRequestMaxRetries(int requestMaxRetries) {
            this.requestMaxRetries = requestMaxRetries;
        }

        public int getRequestRetryBaseDelayMs() {
            return Math.max(0, requestRetryBaseDelayMs);
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
        }

        public int getRequestRetryMaxDelayMs() {
            return Math.max(0, requestRetryMaxDelayMs);
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
        }

        public int getStaticMinTextLength() {
            return Math.max(0, staticMinTextLength);
        }

        public void setStaticMinTextLength(int staticMinTextLength) {
            this.staticMinTextLength = staticMinTextLength;
        }

        public int getMaxSectionLinks() {
            return Math.max(0, maxSectionLinks);
        }

        public void setMaxSectionLinks(int maxSectionLinks) {
            this.maxSectionLinks = maxSectionLinks;
        }
    }

    public static class Browser {
        private boolean enabled = true;
        private String remoteUrl;
        private boolean headless = true;
        private int pageLoadTimeoutSeconds = 60;
        private int settleTimeoutSeconds = 15;
        private int maxScrolls = 6;
        private int scrollPauseMs = 2000;
        private String snapshotDir;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getRemoteUrl() {
            return remoteUrl;
        }

        public void setRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getPageLoadTimeoutSeconds() {
            return Math.max(1, pageLoadTimeoutSeconds);
        }

        public void setPageLoadTimeoutSeconds(int pageLoadTimeoutSeconds) {
            this.pageLoadTimeoutSeconds = pageLoadTimeoutSeconds;
        }

        public int getSettleTimeoutSeconds() {
            return Math.max(1, settleTimeoutSeconds);
        }

        public void setSettleTimeoutSeconds(int settleTimeoutSeconds) {
            this.settleTimeoutSeconds = settleTimeoutSeconds;
        }

        public int getMaxScrolls() {
            return Math.max(0, maxScrolls);
        }

        public void setMaxScrolls(int maxScrolls) {
            this.maxScrolls = maxScrolls;
        }

        public int getScrollPauseMs() {
            return Math.max(0, scrollPauseMs);
        }

        public void setScrollPauseMs(int scrollPauseMs) {
            this.scrollPauseMs = scrollPauseMs;
        }

        public String getSnapshotDir() {
            return snapshotDir;
        }

        public void setSnapshotDir(String snapshotDir) {
            this.snapshotDir = snapshotDir;
        }
    }

    public static class Extraction {
        private int maxSectionChars = 2000;
        private int maxSnippets = 10;

        public int getMaxSectionChars() {
            return Math.max(100, maxSectionChars);
        }

        public void setMaxSectionChars(int maxSectionChars) {
            this.maxSectionChars = maxSectionChars;
        }

        public int getMaxSnippets() {
            return Math.max(1, maxSnippets);
        }

        public void setMaxSnippets(int maxSnippets) {
            this.maxSnippets = maxSnippets;
        }
    }

    public static class Normalization {
        private int minContentLength = 150;
        private String defaultLanguage = "en";
        private String languageModelPath;

        public int getMinContentLength() {
            return Math.max(0, minContentLength);
        }

        public void setMinContentLength(int minContentLength) {
            this.minContentLength = minContentLength;
        }

        public String getDefaultLanguage() {
            return defaultLanguage == null || defaultLanguage.isBlank() ? "en" : defaultLanguage.trim();
        }

        public void setDefaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage;
        }

        public String getLanguageModelPath() {
            return languageModelPath;
        }

        public void setLanguageModelPath(String languageModelPath) {
            this.languageModelPath = languageModelPath;
        }
    }

    public static class Analysis {
        private int topKeywords = 20;
        private int summarySentences = 3;
        private int clusterTopN = 10;
        private double clusterSimilarityThreshold = 0.3;
        private int parallelism = 4;
        private Generative generative = new Generative();

        public int getTopKeywords() {
            return Math.max(1, topKeywords);
        }

        public void setTopKeywords(int topKeywords) {
            this.topKeywords = topKeywords;
        }

        public int getSummarySentences() {
            return Math.max(1, summarySentences);
        }

        public void setSummarySentences(int summarySentences) {
            this.summarySentences = summarySentences;
        }

        public int getClusterTopN() {
            return Math.max(1, clusterTopN);
        }

        public void setClusterTopN(int clusterTopN) {
            this.clusterTopN = clusterTopN;
        }

        public double getClusterSimilarityThreshold() {
            return Math.min(1.0, Math.max(0.0, clusterSimilarityThreshold));
        }

        public void setClusterSimilarityThreshold(double clusterSimilarityThreshold) {
            this.clusterSimilarityThreshold = clusterSimilarityThreshold;
        }

        public int getParallelism() {
            return Math.max(1, parallelism);
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public Generative getGenerative() {
            return generative;
        }

        public void setGenerative(Generative generative) {
            this.generative = generative;
        }
    }

    public static class Generative {
        private String baseUrl;
        private String model = "llama3.2";
        private String apiKey;
        private int timeoutSeconds = 120;
        private int maxInputChars = 4000;

        public boolean isEnabled() {
            return baseUrl != null && !baseUrl.isBlank();
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxInputChars() {
            return Math.max(200, maxInputChars);
        }

        public void setMaxInputChars(int maxInputChars) {
            this.maxInputChars = maxInputChars;
        }
    }

    public static class Aggregation {
        private double nameSimilarityThreshold = 0.85;

        public double getNameSimilarityThreshold() {
            return Math.min(1.0, Math.max(0.0, nameSimilarityThreshold));
        }

        public void setNameSimilarityThreshold(double nameSimilarityThreshold) {
            this.nameSimilarityThreshold = nameSimilarityThreshold;
        }
    }

    public static class Cli {
        private String command;
        private String sources = "sources.csv";
        private String output = "output";
        private String cleaned;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return command != null && !command.isBlank();
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public String getSources() {
            return sources;
        }

        public void setSources(String sources) {
            this.sources = sources;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public String getCleaned() {
            return cleaned;
        }

        public void setCleaned(String cleaned) {
            this.cleaned = cleaned;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
