package com.rewardpick.recommendation.service;

import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.CatalogSnapshot;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.QueryResolution;
import com.rewardpick.recommendation.model.RuleMatch;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds earning rules that apply to a resolved query. A rule applies when any of its
 * categories, MCCs or merchant names matches; the three signals are not weighted.
 */
@Component
public class RuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(RuleMatcher.class);

    private static final int CATEGORY_WEIGHT = 10;
    private static final int MERCHANT_WEIGHT = 20;
    private static final int MCC_WEIGHT = 15;
    private static final int CAP_BONUS = 5;
    private static final int ROTATING_PENALTY = 10;

    /**
     * Every (card, rule) pair whose rule matches, in rule catalog order. Rules pointing at unknown
     * cards are skipped, as are business cards unless {@code includeBusiness} is set.
     *
     * <p>Skipped unknown-card rules only show up at DEBUG here; catalog refresh already counts them
     * and reports them at WARN.
     */
    public List<RuleMatch> matchAll(QueryResolution resolution, CatalogSnapshot catalog, boolean includeBusiness) {
        List<RuleMatch> matches = new ArrayList<>();
        int dangling = 0;

        for (EarningRule rule : catalog.rules()) {
            Optional<CardProduct> card = catalog.findCard(rule.cardId());
            if (card.isEmpty()) {
                dangling++;
                continue;
            }
            if (card.get().businessCard() && !includeBusiness) {
                continue;
            }
            if (matches(rule, resolution)) {
                matches.add(new RuleMatch(card.get(), rule));
            }
        }

        if (dangling > 0) {
            log.debug("Skipped rules referencing unknown cards (count={})", dangling);
        }
        return matches;
    }

    public boolean matches(EarningRule rule, QueryResolution resolution) {
        return categoryMatch(rule, resolution) || mccMatch(rule, resolution) || merchantMatch(rule, resolution);
    }

    /**
     * Higher means more specific: merchant names outweigh MCCs, which outweigh categories.
     * Capped rules get a small bonus and rotating rules a penalty since they may be inactive.
     */
    public static int specificity(EarningRule rule) {
        int score = rule.categories().size() * CATEGORY_WEIGHT
            + rule.merchantNames().size() * MERCHANT_WEIGHT
            + rule.mccs().size() * MCC_WEIGHT;
        if (rule.hasCaps()) {
            score += CAP_BONUS;
        }
        if (rule.rotating()) {
            score -= ROTATING_PENALTY;
        }
        return score;
    }

    /**
     * Stable sort, most specific first. Rules with equal scores keep their catalog order.
     */
    public List<EarningRule> rankBySpecificity(Collection<EarningRule> rules) {
        List<EarningRule> ranked = new ArrayList<>(rules);
        ranked.sort(Comparator.comparingInt(RuleMatcher::specificity).reversed());
        return ranked;
    }

    /**
     * First rule of an already ranked list that matches. Empty means no rule applies; choosing a
     * fallback rate is up to the caller.
     */
    public Optional<EarningRule> findBestRule(QueryResolution resolution, List<EarningRule> rankedRules) {
        for (EarningRule rule : rankedRules) {
            if (matches(rule, resolution)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Rules grouped per eligible card in card catalog order, each group ranked once by
     * specificity. Cards without rules map to an empty list.
     */
    public Map<CardProduct, List<EarningRule>> rankedRulesByCard(CatalogSnapshot catalog, boolean includeBusiness) {
        Map<String, List<EarningRule>> rulesByCardId = new LinkedHashMap<>();
        for (EarningRule rule : catalog.rules()) {
            if (rule.cardId() != null) {
                rulesByCardId.computeIfAbsent(rule.cardId(), key -> new ArrayList<>()).add(rule);
            }
        }

        Map<CardProduct, List<EarningRule>> ranked = new LinkedHashMap<>();
        for (CardProduct card : catalog.cardsById().values()) {
            if (card.businessCard() && !includeBusiness) {
                continue;
            }
            ranked.put(card, rankBySpecificity(rulesByCardId.getOrDefault(card.id(), List.of())));
        }
        return ranked;
    }

    private boolean categoryMatch(EarningRule rule, QueryResolution resolution) {
        if (rule.categories().isEmpty()) {
            return false;
        }
        for (String category : resolution.categories()) {
            if (rule.categories().contains(category)) {
                return true;
            }
        }
        return false;
    }

    private boolean mccMatch(EarningRule rule, QueryResolution resolution) {
        return resolution.mccCode().map(rule.mccs()::contains).orElse(false);
    }

    private boolean merchantMatch(EarningRule rule, QueryResolution resolution) {
        String merchantName = resolution.merchantName();
        if (merchantName == null || merchantName.isBlank() || rule.merchantNames().isEmpty()) {
            return false;
        }

        String merchant = merchantName.toLowerCase(Locale.ROOT);
        for (String candidate : rule.merchantNames()) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            String ruleMerchant = candidate.toLowerCase(Locale.ROOT);
            if (ruleMerchant.contains(merchant) || merchant.contains(ruleMerchant)) {
                return true;
            }
        }
        return false;
    }
}
