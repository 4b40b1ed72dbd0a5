package com.market.intel.pipeline.model;

import java.util.List;
import java.util.Map;

public record CorpusSynthesis(
    int documentCount,
    int analyzedCount,
    int failedCount,
    Map<String, Integer> languageCounts,
    Map<String, Integer> themeCounts,
    List<RankedKeyword> topKeywords,
    List<TermPair> cooccurrences,
    double averageCompletenessScore
) {
}
