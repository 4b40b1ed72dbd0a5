package com.market.intel.pipeline.model;

import java.util.Comparator;

public record RankedKeyword(String term, double score) {
    public static final Comparator<RankedKeyword> RANKING = Comparator
        .comparingDouble(RankedKeyword::score)
        .reversed()
        .thenComparing(RankedKeyword::term);
}
