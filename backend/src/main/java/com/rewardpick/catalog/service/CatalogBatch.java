package com.rewardpick.catalog.service;

import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.EarningRule;
import java.util.List;

/**
 * Validated catalog content ready to become a snapshot. {@code danglingRules} counts rules whose
 * card id is not among {@code cards}.
 */
public record CatalogBatch(List<CardProduct> cards, List<EarningRule> rules, int danglingRules, String source) {

    public CatalogBatch {
        cards = List.copyOf(cards);
        rules = List.copyOf(rules);
    }
}
