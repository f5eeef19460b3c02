package com.rewardpick.recommendation.dto;

import java.util.List;

public record RecommendationResponse(
    String query,
    List<String> resolvedCategories,
    List<CardScoreResponse> candidates,
    String explanation
) {
}
