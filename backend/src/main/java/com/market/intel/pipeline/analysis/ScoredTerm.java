package com.market.intel.pipeline.analysis;

import com.market.intel.pipeline.model.RankedKeyword;

public record ScoredTerm(String lemma, String term, double score) {
    public RankedKeyword toKeyword() {
        return new RankedKeyword(term, score);
    }
}
