package com.rewardpick.catalog.dto;

import java.util.Map;

public record CatalogStatsResponse(
    int totalCards,
    int totalRules,
    int businessCards,
    Map<String, Integer> cardsByIssuer,
    Map<String, Integer> cardsByNetwork,
    Map<String, Integer> cardsByRewardType
) {
}
