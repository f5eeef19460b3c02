package com.rewardpick.recommendation.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Structured reading of a free-text query. Categories are a set; iteration order carries no
 * meaning.
 */
public record QueryResolution(
    String query,
    String merchantName,
    String mcc,
    Set<String> categories,
    boolean knownMerchant
) {

    public QueryResolution {
        Objects.requireNonNull(query, "query must not be null");
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("resolution needs at least one category");
        }
        categories = Collections.unmodifiableSet(new LinkedHashSet<>(categories));
    }

    public Optional<String> mccCode() {
        return Optional.ofNullable(mcc).filter(value -> !value.isBlank());
    }

    public QueryResolution withAdditionalCategories(Collection<String> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>(categories);
        merged.addAll(additional);
        return new QueryResolution(query, merchantName, mcc, merged, knownMerchant);
    }
}
