package com.market.intel.pipeline.model;

public record ProfileItem(String value, String documentId) {
}
