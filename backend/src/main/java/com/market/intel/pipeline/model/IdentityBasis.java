package com.market.intel.pipeline.model;

public enum IdentityBasis {
    DOMAIN,
    NAME,
    DOCUMENT
}
