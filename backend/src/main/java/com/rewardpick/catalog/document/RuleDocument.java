package com.rewardpick.catalog.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDocument(
    @JsonProperty("card_id") String cardId,
    @JsonProperty("description") String description,
    @JsonProperty("merchant_categories") List<String> merchantCategories,
    @JsonProperty("mcc_list") List<String> mccList,
    @JsonProperty("merchant_names") List<String> merchantNames,
    @JsonProperty("multiplier") Double multiplier,
    @JsonProperty("reward_type") String rewardType,
    @JsonProperty("caps") List<CapDocument> caps,
    @JsonProperty("stacking_rules") String stackingRules,
    @JsonProperty("is_rotating") Boolean rotating,
    @JsonProperty("is_intro_offer_only") Boolean introOfferOnly,
    @JsonProperty("valid_from") String validFrom,
    @JsonProperty("valid_to") String validTo
) {
}
