package com.rewardpick.catalog.dto;

import com.rewardpick.catalog.service.CatalogRefreshStatus;
import java.time.Instant;
import java.time.OffsetDateTime;

public record CatalogStatusResponse(
    OffsetDateTime checkedAt,
    String source,
    int cards,
    int rules,
    Instant loadedAt,
    CatalogRefreshStatus lastRefresh
) {
}
