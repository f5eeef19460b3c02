package com.rewardpick.recommendation.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable (cards, rules) pair read by one recommendation call. Replaced as a whole on refresh.
 */
public record CatalogSnapshot(
    List<CardProduct> cards,
    List<EarningRule> rules,
    Map<String, CardProduct> cardsById,
    String source,
    Instant loadedAt
) {

    public CatalogSnapshot {
        Objects.requireNonNull(cards, "card catalog must not be null");
        Objects.requireNonNull(rules, "rule catalog must not be null");
        cards = List.copyOf(cards);
        rules = List.copyOf(rules);
        cardsById = Collections.unmodifiableMap(indexById(cards));
        source = source == null ? "" : source;
        loadedAt = loadedAt == null ? Instant.now() : loadedAt;
    }

    public static CatalogSnapshot of(List<CardProduct> cards, List<EarningRule> rules) {
        return new CatalogSnapshot(cards, rules, null, "inline", Instant.now());
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(List.of(), List.of(), null, "empty", Instant.EPOCH);
    }

    public Optional<CardProduct> findCard(String cardId) {
        return cardId == null ? Optional.empty() : Optional.ofNullable(cardsById.get(cardId));
    }

    public boolean isEmpty() {
        return cards.isEmpty() && rules.isEmpty();
    }

    private static Map<String, CardProduct> indexById(List<CardProduct> cards) {
        Map<String, CardProduct> index = new LinkedHashMap<>();
        for (CardProduct card : cards) {
            index.putIfAbsent(card.id(), card);
        }
        return index;
    }
}
