package com.rewardpick.recommendation.model;

import java.util.Map;
import java.util.Objects;

public record CardProduct(
    String id,
    CardIssuer issuer,
    String name,
    CardNetwork network,
    RewardType rewardType,
    double annualFee,
    double foreignTransactionFee,
    RewardProgram rewardProgram,
    boolean businessCard,
    String officialUrl,
    Map<String, String> metadata
) {

    public CardProduct {
        Objects.requireNonNull(id, "card id must not be null");
        Objects.requireNonNull(rewardType, "card reward type must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
