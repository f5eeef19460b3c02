package com.rewardpick.recommendation.service;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "recommendation")
public class RecommendationProperties {

    /**
     * Number of (card, rule) candidates returned when the caller does not ask for a count.
     */
    private int maxResults = 5;

    /**
     * Cents per point used when a card has no reward program.
     */
    private double defaultPointValueCents = 1.0;

    /**
     * Penalty subtracted from the ranking key per dollar of annual fee, divided by 100.
     * 0 keeps ranking purely by effective rate.
     */
    private double annualFeePenaltyWeight = 0.0;

    /**
     * Match category synonyms and merchant aliases on word boundaries instead of raw substrings.
     */
    private boolean wordBoundaryMatching = false;

    /**
     * Reward program id to cents per point or mile.
     */
    private Map<String, Double> pointValues = defaultPointValues();

    private static Map<String, Double> defaultPointValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("CHASE_UR", 1.7);
        values.put("AMEX_MR", 1.7);
        values.put("CITI_TY", 1.5);
        values.put("CAPITAL_ONE_MILES", 1.6);
        values.put("DISCOVER_CASHBACK", 1.0);
        values.put("BOA_POINTS", 1.0);
        values.put("USBANK_POINTS", 1.2);
        values.put("WELLS_FARGO_POINTS", 1.0);
        values.put("BARCLAYS_POINTS", 1.0);
        values.put("AMERICAN_AIRLINES_MILES", 1.4);
        return values;
    }
}
