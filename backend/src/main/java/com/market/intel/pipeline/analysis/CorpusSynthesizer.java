package com.market.intel.pipeline.analysis;

import com.market.intel.pipeline.model.AnalysisResult;
import com.market.intel.pipeline.model.CorpusSynthesis;
import com.market.intel.pipeline.model.RankedKeyword;
import com.market.intel.pipeline.model.TermPair;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class CorpusSynthesizer {
    static final int TOP_CORPUS_KEYWORDS = 15;

    public CorpusSynthesis synthesize(int documentCount, List<AnalysisResult> results, List<TermPair> cooccurrences) {
        Map<String, Integer> languages = new TreeMap<>();
        Map<String, Integer> themes = new TreeMap<>();
        Map<String, Double> keywordTotals = new HashMap<>();
        int analyzed = 0;
        int failed = 0;
        long completeness = 0;
        for (AnalysisResult result : results) {
            if (result.language() != null) {
                languages.merge(result.language(), 1, Integer::sum);
            }
            if (result.hasError()) {
                failed++;
                continue;
            }
            analyzed++;
            completeness += result.completenessScore();
            if (result.theme() != null) {
                themes.merge(result.theme(), 1, Integer::sum);
            }
            for (RankedKeyword keyword : result.keywords()) {
                keywordTotals.merge(keyword.term(), keyword.score(), Double::sum);
            }
        }
        List<RankedKeyword> topKeywords = keywordTotals.entrySet().stream()
            .map(entry -> new RankedKeyword(entry.getKey(), entry.getValue()))
            .sorted(RankedKeyword.RANKING)
            .limit(TOP_CORPUS_KEYWORDS)
            .toList();
        double averageCompleteness = analyzed == 0 ? 0.0 : (double) completeness / analyzed;
        return new CorpusSynthesis(
            documentCount,
            analyzed,
            failed,
            languages,
            themes,
            topKeywords,
            cooccurrences,
            averageCompleteness
        );
    }
}
