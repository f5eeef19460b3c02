package com.rewardpick.recommendation.model;

import java.util.List;

/**
 * Valued (card, rule) pair. A card appears once per matching rule.
 */
public record CardScore(
    CardProduct card,
    EarningRule rule,
    double effectiveRate,
    String explanation,
    List<String> notes
) {

    public CardScore {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
