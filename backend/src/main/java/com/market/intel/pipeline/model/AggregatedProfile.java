package com.market.intel.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AggregatedProfile(
    String profileId,
    IdentityBasis identityBasis,
    EntityType entityType,
    String domain,
    Map<String, ProfileField> fields,
    List<ProfileItem> emails,
    List<ProfileItem> phones,
    List<ProfileItem> technologies,
    List<ProfileItem> services,
    List<RankedKeyword> keywords,
    String theme,
    Map<String, Integer> themeVotes,
    List<String> clusterIds,
    List<String> documentIds,
    List<String> sourceIds,
    Instant firstCapturedAt,
    Instant lastCapturedAt
) {
}
