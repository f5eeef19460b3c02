package com.rewardpick.recommendation.service;

import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.CardScore;
import com.rewardpick.recommendation.model.ComputedRecommendation;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.QueryResolution;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class RecommendationRanker {

    private final RecommendationProperties properties;

    public RecommendationRanker(RecommendationProperties properties) {
        this.properties = properties;
    }

    /**
     * Sorts by adjusted rate, highest first, and keeps the first {@code maxResults}. The sort is
     * stable: equal rates stay in matching order. With a positive annual fee penalty weight the
     * fee is taken out of the adjusted rate before sorting, and the reported rate is that same
     * penalized value.
     */
    public ComputedRecommendation rank(QueryResolution resolution, List<ValuedMatch> candidates, int maxResults) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be at least 1: " + maxResults);
        }

        List<ValuedMatch> sorted = new ArrayList<>(candidates.size());
        for (ValuedMatch candidate : candidates) {
            sorted.add(applyFeePenalty(candidate));
        }
        sorted.sort(Comparator.comparingDouble(ValuedMatch::adjustedRate).reversed());

        List<CardScore> top = sorted.stream()
            .limit(maxResults)
            .map(candidate -> new CardScore(
                candidate.card(),
                candidate.rule(),
                candidate.adjustedRate(),
                explain(candidate.card(), candidate.rule(), candidate.adjustedRate()),
                notesFor(candidate.rule(), candidate.capNotes())
            ))
            .toList();

        List<String> categories = List.copyOf(resolution.categories());
        return new ComputedRecommendation(
            resolution.query(),
            categories,
            top,
            overallExplanation(resolution.query(), categories, top)
        );
    }

    public String explain(CardProduct card, EarningRule rule, double adjustedRate) {
        return String.format(
            Locale.ROOT,
            "%s offers %s (%.2f%% effective value) for %s",
            card.name(),
            rewardPhrase(rule),
            adjustedRate,
            rule.description()
        );
    }

    public List<String> notesFor(EarningRule rule, List<String> capNotes) {
        List<String> notes = new ArrayList<>(capNotes);
        if (rule.rotating()) {
            notes.add("Rotating category - may require activation");
        }
        if (rule.introOfferOnly()) {
            notes.add("Introductory offer - limited time");
        }
        if (rule.stackingNote() != null && !rule.stackingNote().isBlank()) {
            notes.add("Note: " + rule.stackingNote());
        }
        return notes;
    }

    private ValuedMatch applyFeePenalty(ValuedMatch candidate) {
        double weight = properties.getAnnualFeePenaltyWeight();
        double annualFee = candidate.card().annualFee();
        if (weight <= 0 || annualFee <= 0) {
            return candidate;
        }

        double penalized = Math.max(0.0, candidate.adjustedRate() - weight * annualFee / 100.0);
        List<String> notes = new ArrayList<>(candidate.capNotes());
        notes.add(String.format(
            Locale.US,
            "Annual fee of $%,.0f lowers the effective rate from %.2f%% to %.2f%%",
            annualFee,
            candidate.adjustedRate(),
            penalized
        ));
        return new ValuedMatch(candidate.card(), candidate.rule(), penalized, notes);
    }

    private String overallExplanation(String query, List<String> categories, List<CardScore> top) {
        if (top.isEmpty()) {
            return "No specific rewards found for '" + query + "'. Consider cards with flat-rate rewards.";
        }

        CardScore best = top.get(0);
        StringBuilder explanation = new StringBuilder(String.format(
            Locale.ROOT,
            "For %s (%s), %s offers the best value at %.2f%% effective return.",
            query,
            String.join(", ", categories),
            best.card().name(),
            best.effectiveRate()
        ));

        if (top.size() > 1) {
            CardScore second = top.get(1);
            explanation.append(String.format(
                Locale.ROOT,
                " Other options include %s (%.2f%%).",
                second.card().name(),
                second.effectiveRate()
            ));
        }
        return explanation.toString();
    }

    private String rewardPhrase(EarningRule rule) {
        String multiplier = formatMultiplier(rule.multiplier());
        return switch (rule.rewardType()) {
            case CASHBACK_PERCENT -> multiplier + "% cashback";
            case POINTS_PER_DOLLAR -> multiplier + "x points";
            case MILES_PER_DOLLAR -> multiplier + "x miles";
            case HYBRID -> multiplier + "x rewards";
        };
    }

    private String formatMultiplier(double value) {
        if (Math.abs(value - Math.rint(value)) < 0.00001) {
            return String.format(Locale.ROOT, "%.0f", value);
        }
        return String.format(Locale.ROOT, "%.2f", value).replaceAll("0+$", "").replaceAll("\\.$", "");
    }
}
