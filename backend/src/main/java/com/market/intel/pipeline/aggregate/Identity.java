package com.market.intel.pipeline.aggregate;

import com.market.intel.pipeline.model.IdentityBasis;

public record Identity(String key, IdentityBasis basis) {
}
