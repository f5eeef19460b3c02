package com.rewardpick.recommendation.service;

import static com.rewardpick.recommendation.CatalogFixtures.CHASE_UR;
import static com.rewardpick.recommendation.CatalogFixtures.cashbackCard;
import static com.rewardpick.recommendation.CatalogFixtures.categoryRule;
import static com.rewardpick.recommendation.CatalogFixtures.pointsCard;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.rewardpick.recommendation.model.Cap;
import com.rewardpick.recommendation.model.CapPeriod;
import com.rewardpick.recommendation.model.RewardProgram;
import com.rewardpick.recommendation.model.RewardType;
import java.util.List;
import org.junit.jupiter.api.Test;

class RewardValuatorTest {

    private final RewardValuator valuator = new RewardValuator(PointValuationTable.from(new RecommendationProperties()));

    @Test
    void effectiveRate_should_use_cashback_multiplier_as_is() {
        double rate = valuator.effectiveRate(categoryRule("card", RewardType.CASHBACK_PERCENT, 6.0, "groceries"), null);

        assertThat(rate).isEqualTo(6.0);
    }

    @Test
    void effectiveRate_should_multiply_points_by_configured_value() {
        double rate = valuator.effectiveRate(categoryRule("card", RewardType.POINTS_PER_DOLLAR, 4.0, "groceries"), CHASE_UR);

        assertThat(rate).isCloseTo(6.8, within(1e-9));
    }

    @Test
    void pointValueCents_should_fall_back_to_program_then_default() {
        RewardProgram unlisted = new RewardProgram("HOTEL_POINTS", "Hotel Points", 0.6, null);
        RewardProgram unvalued = new RewardProgram("MYSTERY", "Mystery Points", 0.0, null);
        RewardProgram lowerCaseId = new RewardProgram("chase_ur", "Chase", 0.9, null);

        assertThat(valuator.pointValueCents(unlisted)).isEqualTo(0.6);
        assertThat(valuator.pointValueCents(unvalued)).isEqualTo(1.0);
        assertThat(valuator.pointValueCents(null)).isEqualTo(1.0);
        assertThat(valuator.pointValueCents(lowerCaseId)).isEqualTo(1.7);
    }

    @Test
    void baseRate_should_be_one_percent_for_cashback_and_one_point_otherwise() {
        assertThat(valuator.baseRate(cashbackCard("cash", "Cash"))).isEqualTo(1.0);
        assertThat(valuator.baseRate(pointsCard("points", "Points", CHASE_UR))).isEqualTo(1.7);
    }

    @Test
    void applyCap_should_leave_rate_alone_without_caps() {
        CapAdjustment adjustment = valuator.applyCap(5.0, List.of(), 0.0, 1.0);

        assertThat(adjustment.rate()).isEqualTo(5.0);
        assertThat(adjustment.notes()).isEmpty();
    }

    @Test
    void applyCap_should_blend_evenly_when_spend_is_unknown() {
        CapAdjustment adjustment = valuator.applyCap(5.0, List.of(new Cap(1500.0, CapPeriod.QUARTER)), 0.0, 1.0);

        assertThat(adjustment.rate()).isCloseTo(3.0, within(1e-9));
        assertThat(adjustment.notes()).containsExactly(
            "Spending cap: $1,500/quarter. Blended rate: 3.00% (assumes spending exceeds cap)"
        );
    }

    @Test
    void applyCap_should_blend_by_spend_when_cap_is_exceeded() {
        CapAdjustment adjustment = valuator.applyCap(5.0, List.of(new Cap(1000.0, CapPeriod.YEAR)), 3000.0, 1.0);

        assertThat(adjustment.rate()).isCloseTo(7000.0 / 3000.0, within(1e-9));
        assertThat(adjustment.notes()).containsExactly("Spending cap of $1,000/year exceeded. Blended rate: 2.33%");
    }

    @Test
    void applyCap_should_keep_bonus_rate_within_cap() {
        CapAdjustment adjustment = valuator.applyCap(5.0, List.of(new Cap(1000.0, CapPeriod.YEAR)), 1000.0, 1.0);

        assertThat(adjustment.rate()).isEqualTo(5.0);
        assertThat(adjustment.notes()).containsExactly("Spending cap: $1,000/year (within limit)");
    }

    @Test
    void applyCap_should_only_honour_first_cap() {
        List<Cap> caps = List.of(new Cap(1500.0, CapPeriod.QUARTER), new Cap(100.0, CapPeriod.MONTH));

        CapAdjustment adjustment = valuator.applyCap(5.0, caps, 1200.0, 1.0);

        assertThat(adjustment.rate()).isEqualTo(5.0);
        assertThat(adjustment.notes()).hasSize(1);
        assertThat(adjustment.notes().get(0)).contains("$1,500/quarter");
    }

    @Test
    void applyCap_should_reject_negative_spend() {
        assertThatThrownBy(() -> valuator.applyCap(5.0, List.of(), -1.0, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
