package com.rewardpick.catalog.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CapDocument(
    @JsonProperty("amount_dollars") Double amountDollars,
    @JsonProperty("period") String period,
    @JsonProperty("description") String description
) {
}
