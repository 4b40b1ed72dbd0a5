package com.market.intel.pipeline.model;

public record TermPair(String first, String second, int count) {
}
