package com.rewardpick.recommendation.service;

import static com.rewardpick.recommendation.CatalogFixtures.CHASE_UR;
import static com.rewardpick.recommendation.CatalogFixtures.card;
import static com.rewardpick.recommendation.CatalogFixtures.cashbackCard;
import static com.rewardpick.recommendation.CatalogFixtures.categoryRule;
import static com.rewardpick.recommendation.CatalogFixtures.pointsCard;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.CardScore;
import com.rewardpick.recommendation.model.ComputedRecommendation;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.QueryResolution;
import com.rewardpick.recommendation.model.RewardType;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecommendationRankerTest {

    private RecommendationProperties properties;
    private RecommendationRanker ranker;

    @BeforeEach
    void setUp() {
        properties = new RecommendationProperties();
        ranker = new RecommendationRanker(properties);
    }

    @Test
    void rank_should_sort_by_rate_and_keep_matching_order_for_ties() {
        ValuedMatch first = cashback("first", 2.0);
        ValuedMatch best = cashback("best", 5.0);
        ValuedMatch third = cashback("third", 2.0);

        ComputedRecommendation result = ranker.rank(groceries(), List.of(first, best, third), 5);

        assertThat(result.candidates())
            .extracting(score -> score.card().id())
            .containsExactly("best", "first", "third");
    }

    @Test
    void rank_should_truncate_to_max_results() {
        ComputedRecommendation result = ranker.rank(
            groceries(),
            List.of(cashback("a", 1.0), cashback("b", 3.0), cashback("c", 2.0)),
            2
        );

        assertThat(result.candidates()).extracting(score -> score.card().id()).containsExactly("b", "c");
    }

    @Test
    void rank_should_reject_non_positive_max_results() {
        assertThatThrownBy(() -> ranker.rank(groceries(), List.of(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rank_should_explain_each_candidate_with_reward_phrase() {
        CardProduct flex = pointsCard("flex", "Chase Freedom Flex", CHASE_UR);
        EarningRule rule = new EarningRule(
            "flex",
            "Rotating quarterly categories",
            Set.of("groceries"),
            Set.of(),
            Set.of(),
            5.0,
            RewardType.POINTS_PER_DOLLAR,
            List.of(),
            true,
            true,
            "Activation required each quarter",
            null,
            null
        );

        ComputedRecommendation result = ranker.rank(
            groceries(),
            List.of(new ValuedMatch(flex, rule, 8.5, List.of("Spending cap: $1,500/quarter (within limit)"))),
            5
        );

        CardScore score = result.candidates().get(0);
        assertThat(score.explanation())
            .isEqualTo("Chase Freedom Flex offers 5x points (8.50% effective value) for Rotating quarterly categories");
        assertThat(score.notes()).containsExactly(
            "Spending cap: $1,500/quarter (within limit)",
            "Rotating category - may require activation",
            "Introductory offer - limited time",
            "Note: Activation required each quarter"
        );
    }

    @Test
    void explain_should_format_fractional_cashback() {
        CardProduct quicksilver = cashbackCard("quicksilver", "Capital One Quicksilver");
        EarningRule rule = categoryRule("quicksilver", RewardType.CASHBACK_PERCENT, 1.5, "groceries");

        assertThat(ranker.explain(quicksilver, rule, 1.5))
            .startsWith("Capital One Quicksilver offers 1.5% cashback (1.50% effective value)");
    }

    @Test
    void rank_should_summarize_top_two_candidates() {
        ComputedRecommendation result = ranker.rank(
            groceries(),
            List.of(cashback("second", 3.5, "Blue Cash Preferred"), cashback("top", 6.8, "American Express Gold Card")),
            5
        );

        assertThat(result.explanation()).isEqualTo(
            "For groceries (groceries), American Express Gold Card offers the best value at 6.80% effective return."
                + " Other options include Blue Cash Preferred (3.50%)."
        );
        assertThat(result.resolvedCategories()).containsExactly("groceries");
    }

    @Test
    void rank_should_explain_empty_result() {
        ComputedRecommendation result = ranker.rank(
            new QueryResolution("Macy's", "Macy's", "5311", Set.of("department_store"), true),
            List.of(),
            5
        );

        assertThat(result.candidates()).isEmpty();
        assertThat(result.explanation())
            .isEqualTo("No specific rewards found for 'Macy's'. Consider cards with flat-rate rewards.");
    }

    @Test
    void rank_should_ignore_annual_fee_when_weight_is_zero() {
        CardProduct premium = card("premium", "Premium", RewardType.CASHBACK_PERCENT, null, 150.0, false);
        ValuedMatch premiumMatch = new ValuedMatch(premium, categoryRule("premium", RewardType.CASHBACK_PERCENT, 3.0, "groceries"), 3.0, List.of());

        ComputedRecommendation result = ranker.rank(groceries(), List.of(cashback("free", 2.0), premiumMatch), 5);

        assertThat(result.candidates()).extracting(score -> score.card().id()).containsExactly("premium", "free");
        assertThat(result.candidates().get(0).effectiveRate()).isEqualTo(3.0);
        assertThat(result.candidates().get(0).notes()).isEmpty();
    }

    @Test
    void rank_should_report_fee_penalized_rate_and_stay_sorted_by_it() {
        CardProduct premium = card("premium", "Premium", RewardType.CASHBACK_PERCENT, null, 150.0, false);
        CardProduct luxury = card("luxury", "Luxury", RewardType.CASHBACK_PERCENT, null, 695.0, false);
        ValuedMatch premiumMatch = new ValuedMatch(premium, categoryRule("premium", RewardType.CASHBACK_PERCENT, 3.0, "groceries"), 3.0, List.of());
        ValuedMatch luxuryMatch = new ValuedMatch(luxury, categoryRule("luxury", RewardType.CASHBACK_PERCENT, 6.0, "groceries"), 6.0, List.of());
        properties.setAnnualFeePenaltyWeight(1.0);

        ComputedRecommendation result = ranker.rank(
            groceries(),
            List.of(luxuryMatch, premiumMatch, cashback("free", 2.0)),
            5
        );

        assertThat(result.candidates()).extracting(score -> score.card().id()).containsExactly("free", "premium", "luxury");
        assertThat(result.candidates())
            .extracting(CardScore::effectiveRate)
            .containsExactly(2.0, 1.5, 0.0)
            .isSortedAccordingTo((left, right) -> Double.compare(right, left));
        assertThat(result.candidates().get(1).notes())
            .anyMatch(note -> note.contains("Annual fee of $150 lowers the effective rate from 3.00% to 1.50%"));
        assertThat(result.explanation()).contains("Other options include Premium (1.50%)");
    }

    private ValuedMatch cashback(String id, double rate) {
        return cashback(id, rate, id);
    }

    private ValuedMatch cashback(String id, double rate, String name) {
        CardProduct card = cashbackCard(id, name);
        return new ValuedMatch(card, categoryRule(id, RewardType.CASHBACK_PERCENT, rate, "groceries"), rate, List.of());
    }

    private QueryResolution groceries() {
        return new QueryResolution("groceries", "groceries", null, Set.of("groceries"), false);
    }
}
