package com.market.intel.pipeline.model;

import java.util.List;

public record AnalysisResult(
    String documentId,
    String language,
    List<RankedKeyword> keywords,
    String theme,
    String summary,
    String summaryMethod,
    String clusterId,
    int tokenCount,
    int completenessScore,
    String error
) {
    public static AnalysisResult failed(String documentId, String language, String error) {
        return new AnalysisResult(documentId, language, List.of(), null, "", null, null, 0, 0, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public AnalysisResult withClusterId(String cluster) {
        return new AnalysisResult(
            documentId,
            language,
            keywords,
            theme,
            summary,
            summaryMethod,
            cluster,
            tokenCount,
            completenessScore,
            error
        );
    }
}
