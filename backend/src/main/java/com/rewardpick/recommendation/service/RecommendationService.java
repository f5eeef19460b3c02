package com.rewardpick.recommendation.service;

import com.rewardpick.catalog.service.CatalogSnapshotHolder;
import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.CatalogSnapshot;
import com.rewardpick.recommendation.model.ComputedRecommendation;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.QueryResolution;
import com.rewardpick.recommendation.model.RuleMatch;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers "which card should I use for this purchase?".
 *
 * <p>Pipeline: normalize the query, match every rule in the catalog, value each match in cents
 * per dollar, then rank and explain. A card with several matching rules shows up once per rule.
 * All calls are pure with respect to the catalog they read.
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    static final String NO_MATCH_NOTE = "No bonus rule matched";
    private static final String BASE_RATE_DESCRIPTION = "base rate on all purchases";

    private final QueryNormalizer queryNormalizer;
    private final RuleMatcher ruleMatcher;
    private final RewardValuator rewardValuator;
    private final RecommendationRanker recommendationRanker;
    private final CatalogSnapshotHolder snapshotHolder;
    private final RecommendationProperties properties;

    public RecommendationService(
        QueryNormalizer queryNormalizer,
        RuleMatcher ruleMatcher,
        RewardValuator rewardValuator,
        RecommendationRanker recommendationRanker,
        CatalogSnapshotHolder snapshotHolder,
        RecommendationProperties properties
    ) {
        this.queryNormalizer = queryNormalizer;
        this.ruleMatcher = ruleMatcher;
        this.rewardValuator = rewardValuator;
        this.recommendationRanker = recommendationRanker;
        this.snapshotHolder = snapshotHolder;
        this.properties = properties;
    }

    public ComputedRecommendation resolve(
        String query,
        List<CardProduct> cards,
        List<EarningRule> rules,
        int maxResults,
        boolean includeBusiness
    ) {
        return resolve(query, cards, rules, maxResults, includeBusiness, 0.0);
    }

    /**
     * Ranks the (card, rule) pairs of the given catalog for {@code query}. {@code spendingAmount}
     * of 0 means no spend was supplied.
     */
    public ComputedRecommendation resolve(
        String query,
        List<CardProduct> cards,
        List<EarningRule> rules,
        int maxResults,
        boolean includeBusiness,
        double spendingAmount
    ) {
        Objects.requireNonNull(cards, "card catalog must not be null");
        Objects.requireNonNull(rules, "rule catalog must not be null");
        requireValidArguments(maxResults, spendingAmount);

        QueryResolution resolution = resolveQuery(query);
        return compute(resolution, CatalogSnapshot.of(cards, rules), maxResults, includeBusiness, spendingAmount);
    }

    /**
     * Same as {@link #resolve} against the catalog currently loaded.
     */
    public ComputedRecommendation recommend(String query, int maxResults, boolean includeBusiness, double spendingAmount) {
        requireValidArguments(maxResults, spendingAmount);

        QueryResolution resolution = resolveQuery(query);
        return compute(resolution, snapshotHolder.current(), maxResults, includeBusiness, spendingAmount);
    }

    public ComputedRecommendation recommend(String query) {
        return recommend(query, properties.getMaxResults(), false, 0.0);
    }

    /**
     * One entry per eligible card, valued with its most specific matching rule. Cards with no
     * matching rule are valued at their base rate.
     */
    public ComputedRecommendation recommendPerCard(String query, boolean includeBusiness, double spendingAmount) {
        requireValidArguments(1, spendingAmount);

        QueryResolution resolution = resolveQuery(query);
        CatalogSnapshot catalog = snapshotHolder.current();

        List<ValuedMatch> valued = new ArrayList<>();
        for (Map.Entry<CardProduct, List<EarningRule>> entry : ruleMatcher.rankedRulesByCard(catalog, includeBusiness).entrySet()) {
            CardProduct card = entry.getKey();
            Optional<EarningRule> best = ruleMatcher.findBestRule(resolution, entry.getValue());
            if (best.isPresent()) {
                valued.add(value(card, best.get(), spendingAmount));
            } else {
                EarningRule baseRule = baseRateRule(card);
                double rate = Math.max(0.0, rewardValuator.baseRate(card));
                valued.add(new ValuedMatch(card, baseRule, rate, List.of(NO_MATCH_NOTE)));
            }
        }

        return recommendationRanker.rank(resolution, valued, Math.max(1, valued.size()));
    }

    /**
     * Normalizes the query and widens its categories with those implied by its MCC.
     */
    public QueryResolution resolveQuery(String query) {
        QueryResolution resolution = queryNormalizer.normalize(query);
        QueryResolution widened = resolution.mccCode()
            .map(queryNormalizer::categoriesForMcc)
            .map(resolution::withAdditionalCategories)
            .orElse(resolution);

        log.debug(
            "Resolved query (query={}, merchant={}, mcc={}, categories={}, knownMerchant={})",
            query,
            widened.merchantName(),
            widened.mcc(),
            widened.categories(),
            widened.knownMerchant()
        );
        return widened;
    }

    private ComputedRecommendation compute(
        QueryResolution resolution,
        CatalogSnapshot catalog,
        int maxResults,
        boolean includeBusiness,
        double spendingAmount
    ) {
        List<RuleMatch> matches = ruleMatcher.matchAll(resolution, catalog, includeBusiness);

        List<ValuedMatch> valued = new ArrayList<>(matches.size());
        for (RuleMatch match : matches) {
            valued.add(value(match.card(), match.rule(), spendingAmount));
        }
        return recommendationRanker.rank(resolution, valued, maxResults);
    }

    private ValuedMatch value(CardProduct card, EarningRule rule, double spendingAmount) {
        double effectiveRate = rewardValuator.effectiveRate(rule, card.rewardProgram());
        double baseRate = rewardValuator.baseRate(card);
        CapAdjustment adjustment = rewardValuator.applyCap(effectiveRate, rule.caps(), spendingAmount, baseRate);
        return new ValuedMatch(card, rule, Math.max(0.0, adjustment.rate()), adjustment.notes());
    }

    private EarningRule baseRateRule(CardProduct card) {
        return new EarningRule(
            card.id(),
            BASE_RATE_DESCRIPTION,
            Set.of(),
            Set.of(),
            Set.of(),
            1.0,
            card.rewardType(),
            List.of(),
            false,
            false,
            null,
            null,
            null
        );
    }

    private void requireValidArguments(int maxResults, double spendingAmount) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be at least 1: " + maxResults);
        }
        if (spendingAmount < 0 || !Double.isFinite(spendingAmount)) {
            throw new IllegalArgumentException("spendingAmount must be a non-negative number: " + spendingAmount);
        }
    }
}
