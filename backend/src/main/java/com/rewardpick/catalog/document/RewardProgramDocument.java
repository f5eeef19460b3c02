package com.rewardpick.catalog.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RewardProgramDocument(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("base_point_value_cents") Double basePointValueCents,
    @JsonProperty("notes") String notes
) {
}
