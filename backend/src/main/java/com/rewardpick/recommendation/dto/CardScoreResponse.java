package com.rewardpick.recommendation.dto;

import java.util.List;

public record CardScoreResponse(
    int rank,
    String cardId,
    String cardName,
    String issuer,
    String network,
    String rewardType,
    double annualFee,
    boolean businessCard,
    String officialUrl,
    String ruleDescription,
    double multiplier,
    double effectiveRate,
    String explanation,
    List<String> notes
) {
}
