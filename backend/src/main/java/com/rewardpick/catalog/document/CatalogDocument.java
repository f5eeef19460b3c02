package com.rewardpick.catalog.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Raw, unvalidated catalog content as read from one source.
 */
public record CatalogDocument(String source, List<CardDocument> cards, List<RuleDocument> rules) {

    public CatalogDocument {
        cards = cards == null ? List.of() : cards.stream().filter(Objects::nonNull).toList();
        rules = rules == null ? List.of() : rules.stream().filter(Objects::nonNull).toList();
    }

    public static CatalogDocument merge(List<CatalogDocument> documents) {
        List<String> sources = new ArrayList<>();
        List<CardDocument> cards = new ArrayList<>();
        List<RuleDocument> rules = new ArrayList<>();
        for (CatalogDocument document : documents) {
            sources.add(document.source());
            cards.addAll(document.cards());
            rules.addAll(document.rules());
        }
        return new CatalogDocument(String.join(",", sources), cards, rules);
    }
}
