package com.market.intel.pipeline.analysis;

import com.market.intel.pipeline.model.AnalysisResult;
import com.market.intel.pipeline.model.CorpusSynthesis;

import java.util.List;

public record AnalysisOutcome(List<AnalysisResult> results, CorpusSynthesis synthesis) {
    public long failureCount() {
        return results.stream().filter(AnalysisResult::hasError).count();
    }
}
