package com.rewardpick.catalog.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Card entry of {@code cards.json}. {@code rewardText} holds issuer marketing copy that is parsed
 * into earning rules when present.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CardDocument(
    @JsonProperty("id") String id,
    @JsonProperty("issuer") IssuerDocument issuer,
    @JsonProperty("name") String name,
    @JsonProperty("network") String network,
    @JsonProperty("type") String type,
    @JsonProperty("annual_fee") Double annualFee,
    @JsonProperty("foreign_transaction_fee") Double foreignTransactionFee,
    @JsonProperty("reward_program") RewardProgramDocument rewardProgram,
    @JsonProperty("is_business_card") Boolean businessCard,
    @JsonProperty("official_url") String officialUrl,
    @JsonProperty("metadata") Map<String, String> metadata,
    @JsonProperty("reward_text") String rewardText
) {
}
