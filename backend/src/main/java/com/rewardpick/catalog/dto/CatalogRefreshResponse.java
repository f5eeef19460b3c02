package com.rewardpick.catalog.dto;

import java.time.Instant;

public record CatalogRefreshResponse(
    String trigger,
    String source,
    int cards,
    int rules,
    Integer danglingRules,
    Instant loadedAt
) {
}
