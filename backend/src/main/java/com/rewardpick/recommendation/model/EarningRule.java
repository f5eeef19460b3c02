package com.rewardpick.recommendation.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One way a card earns rewards. {@code multiplier} is a percentage for cashback rules and a
 * per-dollar count of points or miles otherwise. {@code cardId} may reference a card that is
 * not in the catalog.
 */
public record EarningRule(
    String cardId,
    String description,
    Set<String> categories,
    Set<String> mccs,
    Set<String> merchantNames,
    double multiplier,
    RewardType rewardType,
    List<Cap> caps,
    boolean rotating,
    boolean introOfferOnly,
    String stackingNote,
    LocalDate validFrom,
    LocalDate validTo
) {

    public EarningRule {
        Objects.requireNonNull(rewardType, "rule reward type must not be null");
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        mccs = mccs == null ? Set.of() : Set.copyOf(mccs);
        merchantNames = merchantNames == null ? Set.of() : Set.copyOf(merchantNames);
        caps = caps == null ? List.of() : List.copyOf(caps);
    }

    public boolean hasCaps() {
        return !caps.isEmpty();
    }
}
