package com.rewardpick.catalog.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.rewardpick.catalog.document.CapDocument;
import com.rewardpick.catalog.document.CardDocument;
import com.rewardpick.catalog.document.CatalogDocument;
import com.rewardpick.catalog.document.IssuerDocument;
import com.rewardpick.catalog.document.RewardProgramDocument;
import com.rewardpick.catalog.document.RuleDocument;
import com.rewardpick.recommendation.model.CapPeriod;
import com.rewardpick.recommendation.model.CardNetwork;
import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.RewardType;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CatalogValidatorTest {

    private final CatalogValidator validator = new CatalogValidator(new RewardTextParser());

    @Test
    void validate_should_convert_documents_into_domain_model() {
        CatalogDocument document = new CatalogDocument(
            "test",
            List.of(pointsCard("chase_sapphire_preferred", false, null)),
            List.of(new RuleDocument(
                "chase_sapphire_preferred",
                "Dining purchases",
                List.of(" Restaurants "),
                List.of("5812"),
                List.of(),
                3.0,
                "points_per_dollar",
                List.of(new CapDocument(1500.0, "quarter", "Quarterly cap")),
                "Not valid on delivery apps",
                false,
                true,
                "2024-01-01",
                "2024-12-31"
            ))
        );

        CatalogBatch batch = validator.validate(document);

        CardProduct card = batch.cards().get(0);
        assertThat(card.network()).isEqualTo(CardNetwork.VISA);
        assertThat(card.rewardType()).isEqualTo(RewardType.POINTS_PER_DOLLAR);
        assertThat(card.rewardProgram().id()).isEqualTo("CHASE_UR");
        assertThat(card.rewardProgram().basePointValueCents()).isEqualTo(1.7);
        assertThat(card.issuer().name()).isEqualTo("Chase");
        assertThat(card.businessCard()).isFalse();

        EarningRule rule = batch.rules().get(0);
        assertThat(rule.categories()).containsExactly("restaurants");
        assertThat(rule.mccs()).containsExactly("5812");
        assertThat(rule.caps()).hasSize(1);
        assertThat(rule.caps().get(0).period()).isEqualTo(CapPeriod.QUARTER);
        assertThat(rule.caps().get(0).description()).isEqualTo("Quarterly cap");
        assertThat(rule.introOfferOnly()).isTrue();
        assertThat(rule.stackingNote()).isEqualTo("Not valid on delivery apps");
        assertThat(rule.validFrom()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(batch.danglingRules()).isZero();
        assertThat(batch.source()).isEqualTo("test");
    }

    @Test
    void validate_should_keep_and_count_rules_for_unknown_cards() {
        CatalogDocument document = new CatalogDocument(
            "test",
            List.of(pointsCard("known", false, null)),
            List.of(rule("known", 3.0, "points_per_dollar"), rule("retired_card", 2.0, "cashback_percent"))
        );

        CatalogBatch batch = validator.validate(document);

        assertThat(batch.rules()).hasSize(2);
        assertThat(batch.danglingRules()).isEqualTo(1);
    }

    @Test
    void validate_should_append_rules_parsed_from_reward_text() {
        CardDocument card = new CardDocument(
            "boa_customized_cash",
            new IssuerDocument("Bank of America", null, null),
            "Customized Cash Rewards",
            "visa",
            "cashback_percent",
            0.0,
            0.03,
            null,
            null,
            null,
            Map.of(),
            "3% cash back at gas stations, on up to $2,500 in combined purchases each quarter."
        );

        CatalogBatch batch = validator.validate(new CatalogDocument("test", List.of(card), List.of()));

        assertThat(batch.rules()).hasSize(1);
        assertThat(batch.rules().get(0).cardId()).isEqualTo("boa_customized_cash");
        assertThat(batch.rules().get(0).categories()).containsExactly("gas");
    }

    @Test
    void validate_should_collect_all_violations() {
        CardDocument unknownType = new CardDocument(
            "crypto_card", null, "Crypto Card", "visa", "crypto", null, null, null, null, null, null, null
        );
        CatalogDocument document = new CatalogDocument(
            "broken.json",
            List.of(pointsCard("dup", false, null), pointsCard("dup", false, null), unknownType, pointsCard(" ", false, null)),
            List.of(
                rule("dup", -1.0, "cashback_percent"),
                new RuleDocument("dup", "bad cap", List.of("gas"), null, null, 2.0, "cashback_percent",
                    List.of(new CapDocument(0.0, "year", null), new CapDocument(100.0, "decade", null)),
                    null, null, null, "2024-12-31", "2024-01-01"),
                new RuleDocument("dup", "bad date", List.of("gas"), null, null, 2.0, "cashback_percent",
                    null, null, null, null, "next tuesday", null)
            )
        );

        CatalogValidationException exception = catchThrowableOfType(
            () -> validator.validate(document),
            CatalogValidationException.class
        );

        assertThat(exception.getMessage()).startsWith("Catalog from broken.json rejected");
        assertThat(exception.getViolations()).anyMatch(v -> v.contains("'dup' is listed more than once"));
        assertThat(exception.getViolations()).anyMatch(v -> v.contains("Unknown reward type: crypto"));
        assertThat(exception.getViolations()).anyMatch(v -> v.contains("card[3] has no id"));
        assertThat(exception.getViolations()).anyMatch(v -> v.contains("multiplier must be a non-negative number"));
        assertThat(exception.getViolations()).anyMatch(v -> v.contains("cap amount 0.0"));
        assertThat(exception.getViolations()).anyMatch(v -> v.contains("Unknown cap period: decade"));
        assertThat(exception.getViolations()).anyMatch(v -> v.contains("valid from 2024-12-31 after 2024-01-01"));
        assertThat(exception.getViolations()).anyMatch(v -> v.contains("not an ISO date: next tuesday"));
    }

    @Test
    void validate_should_reject_unknown_network_and_negative_fee() {
        CardDocument card = new CardDocument(
            "card", null, "Card", "diners", "cashback_percent", -95.0, null, null, true, null, null, null
        );

        assertThatThrownBy(() -> validator.validate(new CatalogDocument("test", List.of(card), List.of())))
            .isInstanceOf(CatalogValidationException.class)
            .hasMessageContaining("Unknown card network: diners")
            .hasMessageContaining("annual_fee must be a non-negative number");
    }

    private CardDocument pointsCard(String id, boolean business, String rewardText) {
        return new CardDocument(
            id,
            new IssuerDocument("Chase", "https://www.chase.com", null),
            "Chase Sapphire Preferred",
            "visa",
            "points_per_dollar",
            95.0,
            0.0,
            new RewardProgramDocument("CHASE_UR", "Chase Ultimate Rewards", 1.7, null),
            business,
            "https://www.chase.com/credit-cards/sapphire-preferred",
            Map.of("source", "test"),
            rewardText
        );
    }

    private RuleDocument rule(String cardId, double multiplier, String rewardType) {
        return new RuleDocument(
            cardId,
            "Bonus",
            List.of("groceries"),
            null,
            null,
            multiplier,
            rewardType,
            null,
            null,
            null,
            null,
            null,
            null
        );
    }
}
