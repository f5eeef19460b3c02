package com.rewardpick.catalog.dto;

public record CardResponse(
    String id,
    String name,
    String issuer,
    String network,
    String rewardType,
    double annualFee,
    double foreignTransactionFee,
    String rewardProgramId,
    boolean businessCard,
    String officialUrl
) {
}
