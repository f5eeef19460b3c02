package com.rewardpick.catalog.service;

import com.rewardpick.catalog.document.CapDocument;
import com.rewardpick.catalog.document.CardDocument;
import com.rewardpick.catalog.document.CatalogDocument;
import com.rewardpick.catalog.document.RuleDocument;
import com.rewardpick.recommendation.model.Cap;
import com.rewardpick.recommendation.model.CapPeriod;
import com.rewardpick.recommendation.model.CardIssuer;
import com.rewardpick.recommendation.model.CardNetwork;
import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.RewardProgram;
import com.rewardpick.recommendation.model.RewardType;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw catalog documents into the domain model. Everything the resolver takes for
 * granted is checked here; all violations are collected before failing so one bad file reports
 * every problem at once.
 */
@Component
public class CatalogValidator {

    private static final Logger log = LoggerFactory.getLogger(CatalogValidator.class);

    private final RewardTextParser rewardTextParser;

    public CatalogValidator(RewardTextParser rewardTextParser) {
        this.rewardTextParser = rewardTextParser;
    }

    public CatalogBatch validate(CatalogDocument document) {
        List<String> violations = new ArrayList<>();
        List<CardProduct> cards = new ArrayList<>();
        List<EarningRule> rules = new ArrayList<>();
        List<EarningRule> parsedRules = new ArrayList<>();
        Set<String> cardIds = new HashSet<>();

        for (int index = 0; index < document.cards().size(); index++) {
            CardDocument card = document.cards().get(index);
            String label = "card[" + index + "]";

            String id = safe(card.id());
            if (id.isEmpty()) {
                violations.add(label + " has no id");
                continue;
            }
            label = "card '" + id + "'";
            if (!cardIds.add(id)) {
                violations.add(label + " is listed more than once");
                continue;
            }

            CardProduct product = toCard(card, id, label, violations);
            if (product == null) {
                continue;
            }
            cards.add(product);

            if (card.rewardText() != null && !card.rewardText().isBlank()) {
                parsedRules.addAll(rewardTextParser.parse(id, card.rewardText()));
            }
        }

        for (int index = 0; index < document.rules().size(); index++) {
            EarningRule rule = toRule(document.rules().get(index), "rule[" + index + "]", violations);
            if (rule != null) {
                rules.add(rule);
            }
        }
        rules.addAll(parsedRules);

        if (!violations.isEmpty()) {
            throw new CatalogValidationException(document.source(), violations);
        }

        int dangling = (int) rules.stream().filter(rule -> !cardIds.contains(rule.cardId())).count();
        if (dangling > 0) {
            log.warn("Catalog rules reference unknown cards (source={}, count={})", document.source(), dangling);
        }
        return new CatalogBatch(cards, rules, dangling, document.source());
    }

    private CardProduct toCard(CardDocument card, String id, String label, List<String> violations) {
        int before = violations.size();

        String name = safe(card.name());
        if (name.isEmpty()) {
            violations.add(label + " has no name");
        }

        RewardType rewardType = parseCode(card.type(), RewardType::fromCode, label + " type", violations);
        CardNetwork network = card.network() == null || card.network().isBlank()
            ? null
            : parseCode(card.network(), CardNetwork::fromCode, label + " network", violations);

        double annualFee = nonNegative(card.annualFee(), label + " annual_fee", violations);
        double foreignFee = nonNegative(card.foreignTransactionFee(), label + " foreign_transaction_fee", violations);

        RewardProgram program = null;
        if (card.rewardProgram() != null) {
            String programId = safe(card.rewardProgram().id());
            if (programId.isEmpty()) {
                violations.add(label + " reward_program has no id");
            }
            double baseValue = nonNegative(
                card.rewardProgram().basePointValueCents(),
                label + " reward_program.base_point_value_cents",
                violations
            );
            program = new RewardProgram(programId, card.rewardProgram().name(), baseValue, card.rewardProgram().notes());
        }

        if (violations.size() > before) {
            return null;
        }

        CardIssuer issuer = card.issuer() == null
            ? null
            : new CardIssuer(card.issuer().name(), card.issuer().websiteUrl(), card.issuer().supportContact());

        return new CardProduct(
            id,
            issuer,
            name,
            network,
            rewardType,
            annualFee,
            foreignFee,
            program,
            Boolean.TRUE.equals(card.businessCard()),
            card.officialUrl(),
            card.metadata()
        );
    }

    private EarningRule toRule(RuleDocument rule, String label, List<String> violations) {
        int before = violations.size();

        String cardId = safe(rule.cardId());
        if (cardId.isEmpty()) {
            violations.add(label + " has no card_id");
        } else {
            label = label + " of '" + cardId + "'";
        }

        RewardType rewardType = parseCode(rule.rewardType(), RewardType::fromCode, label + " reward_type", violations);

        double multiplier = 0.0;
        if (rule.multiplier() == null) {
            violations.add(label + " has no multiplier");
        } else {
            multiplier = nonNegative(rule.multiplier(), label + " multiplier", violations);
        }

        List<Cap> caps = new ArrayList<>();
        if (rule.caps() != null) {
            for (CapDocument cap : rule.caps()) {
                if (cap == null) {
                    continue;
                }
                if (cap.amountDollars() == null || !Double.isFinite(cap.amountDollars()) || cap.amountDollars() <= 0) {
                    violations.add(label + " has cap amount " + cap.amountDollars() + ", must be above 0");
                    continue;
                }
                CapPeriod period = parseCode(cap.period(), CapPeriod::fromCode, label + " cap period", violations);
                if (period != null) {
                    caps.add(new Cap(cap.amountDollars(), period, cap.description()));
                }
            }
        }

        LocalDate validFrom = parseDate(rule.validFrom(), label + " valid_from", violations);
        LocalDate validTo = parseDate(rule.validTo(), label + " valid_to", violations);
        if (validFrom != null && validTo != null && validFrom.isAfter(validTo)) {
            violations.add(label + " is valid from " + validFrom + " after " + validTo);
        }

        if (violations.size() > before) {
            return null;
        }

        return new EarningRule(
            cardId,
            rule.description(),
            lowerCased(rule.merchantCategories()),
            trimmed(rule.mccList()),
            trimmed(rule.merchantNames()),
            multiplier,
            rewardType,
            caps,
            Boolean.TRUE.equals(rule.rotating()),
            Boolean.TRUE.equals(rule.introOfferOnly()),
            rule.stackingRules(),
            validFrom,
            validTo
        );
    }

    private <T> T parseCode(String value, Function<String, T> parser, String label, List<String> violations) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException exception) {
            violations.add(label + ": " + exception.getMessage());
            return null;
        }
    }

    private double nonNegative(Double value, String label, List<String> violations) {
        if (value == null) {
            return 0.0;
        }
        if (!Double.isFinite(value) || value < 0) {
            violations.add(label + " must be a non-negative number, was " + value);
            return 0.0;
        }
        return value;
    }

    private LocalDate parseDate(String value, String label, List<String> violations) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException exception) {
            violations.add(label + " is not an ISO date: " + value);
            return null;
        }
    }

    private Set<String> lowerCased(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                String normalized = safe(value).toLowerCase(Locale.ROOT);
                if (!normalized.isEmpty()) {
                    result.add(normalized);
                }
            }
        }
        return result;
    }

    private Set<String> trimmed(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                String normalized = safe(value);
                if (!normalized.isEmpty()) {
                    result.add(normalized);
                }
            }
        }
        return result;
    }

    private String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
