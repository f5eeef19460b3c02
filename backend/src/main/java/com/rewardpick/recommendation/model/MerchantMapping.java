package com.rewardpick.recommendation.model;

import java.util.List;
import java.util.Objects;

/**
 * Known merchant: canonical lookup key, display name, MCC, categories and aliases.
 */
public record MerchantMapping(
    String key,
    String merchantName,
    String mcc,
    List<String> categories,
    List<String> aliases
) {

    public MerchantMapping {
        Objects.requireNonNull(key, "merchant key must not be null");
        Objects.requireNonNull(merchantName, "merchant name must not be null");
        categories = categories == null ? List.of() : List.copyOf(categories);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
