package com.rewardpick.recommendation.model;

import java.util.List;

public record ComputedRecommendation(
    String query,
    List<String> resolvedCategories,
    List<CardScore> candidates,
    String explanation
) {

    public ComputedRecommendation {
        resolvedCategories = List.copyOf(resolvedCategories);
        candidates = List.copyOf(candidates);
    }
}
