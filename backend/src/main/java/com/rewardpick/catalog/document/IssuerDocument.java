package com.rewardpick.catalog.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IssuerDocument(
    @JsonProperty("name") String name,
    @JsonProperty("website_url") String websiteUrl,
    @JsonProperty("support_contact") String supportContact
) {
}
