package com.rewardpick.recommendation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record RecommendationRequest(
    @NotBlank
    String query,

    @Min(1) @Max(20)
    Integer maxResults,

    Boolean includeBusiness,

    @PositiveOrZero
    Double spendingAmount
) {
}
