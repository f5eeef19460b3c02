package com.rewardpick.catalog.service;

import com.rewardpick.recommendation.model.Cap;
import com.rewardpick.recommendation.model.CapPeriod;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.RewardType;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns issuer reward copy such as "6% cash back at U.S. supermarkets, on up to $6,000 in
 * spending per year" into earning rules. One pattern list and one category keyword table serve
 * every issuer.
 */
@Component
public class RewardTextParser {

    private static final Pattern US_ABBREVIATION = Pattern.compile("\\b[Uu]\\.[Ss]\\.");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<!\\d)\\.(?!\\d)|[\\n;]");
    private static final Pattern CAP_PATTERN = Pattern.compile(
        "up\\s+to\\s+\\$\\s*([0-9]{1,3}(?:,[0-9]{3})+|[0-9]+(?:\\.[0-9]+)?)\\s+(?:in\\s+[a-z\\s]+?\\s+)?(?:per|each|a|every)\\s+(year|quarter|month)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern ROTATING_PATTERN = Pattern.compile("rotating|quarterly|changes", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTRO_PATTERN = Pattern.compile("\\b(?:first\\s+year|intro(?:ductory)?)\\b", Pattern.CASE_INSENSITIVE);

    private static final int MIN_SENTENCE_LENGTH = 10;

    private static final List<String> SKIP_PHRASES = List.of(
        "compare", " vs ", "versus", "better than", "prominent brands", "heard of", "advertisement", "sponsored"
    );

    private static final List<RewardPattern> REWARD_PATTERNS = List.of(
        new RewardPattern(
            RewardType.CASHBACK_PERCENT,
            Pattern.compile("([0-9]+(?:\\.[0-9]+)?)\\s*%\\s*cash\\s*back\\s+(?:at|on|for)\\s+([^,]+)", Pattern.CASE_INSENSITIVE)
        ),
        new RewardPattern(
            RewardType.POINTS_PER_DOLLAR,
            Pattern.compile("([0-9]+(?:\\.[0-9]+)?)\\s*x\\s+points?\\s+(?:on|for|at)\\s+([^,]+)", Pattern.CASE_INSENSITIVE)
        ),
        new RewardPattern(
            RewardType.MILES_PER_DOLLAR,
            Pattern.compile("([0-9]+(?:\\.[0-9]+)?)\\s*x\\s+miles?\\s+(?:on|for|at)\\s+([^,]+)", Pattern.CASE_INSENSITIVE)
        ),
        new RewardPattern(
            RewardType.MILES_PER_DOLLAR,
            Pattern.compile("([0-9]+(?:\\.[0-9]+)?)\\s*miles?\\s+per\\s+dollar\\s+(?:on|for|at)\\s+([^,]+)", Pattern.CASE_INSENSITIVE)
        )
    );

    private static final List<CategoryKeywordRule> CATEGORY_KEYWORD_RULES = List.of(
        new CategoryKeywordRule("groceries", List.of("supermarket", "supermarkets", "grocery", "grocery store", "grocery stores", "food store")),
        new CategoryKeywordRule("restaurants", List.of("restaurant", "dining", "dine", "food", "fast food", "cafe")),
        new CategoryKeywordRule("travel", List.of("travel", "trip", "airline", "hotel", "flight", "airport", "lodging")),
        new CategoryKeywordRule("gas", List.of("gas", "gasoline", "fuel", "gas station", "gas stations")),
        new CategoryKeywordRule("streaming", List.of("streaming", "netflix", "spotify", "hulu", "disney", "entertainment")),
        new CategoryKeywordRule("utilities", List.of("utility", "phone", "internet", "cable", "electric", "water")),
        new CategoryKeywordRule("pharmacy", List.of("pharmacy", "drugstore", "cvs", "walgreens", "rite aid")),
        new CategoryKeywordRule("entertainment", List.of("entertainment", "movie", "theater", "cinema", "concert")),
        new CategoryKeywordRule("transit", List.of("transit", "uber", "lyft", "taxi", "public transportation")),
        new CategoryKeywordRule("online_shopping", List.of("online", "internet", "e-commerce")),
        new CategoryKeywordRule("department_store", List.of("department store", "retail")),
        new CategoryKeywordRule("wholesale", List.of("wholesale", "warehouse", "costco", "sam's club"))
    );

    public List<EarningRule> parse(String cardId, String text) {
        List<EarningRule> rules = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return rules;
        }

        String flattened = US_ABBREVIATION.matcher(text).replaceAll("US");
        for (String rawSentence : SENTENCE_BREAK.split(flattened)) {
            String sentence = rawSentence.trim();
            if (sentence.length() < MIN_SENTENCE_LENGTH || isMarketingCopy(sentence)) {
                continue;
            }

            for (RewardPattern rewardPattern : REWARD_PATTERNS) {
                Matcher matcher = rewardPattern.pattern().matcher(sentence);
                if (!matcher.find()) {
                    continue;
                }

                double multiplier = Double.parseDouble(matcher.group(1));
                String categoryText = matcher.group(2).trim();

                rules.add(new EarningRule(
                    cardId,
                    sentence,
                    extractCategories(categoryText),
                    Set.of(),
                    Set.of(),
                    multiplier,
                    rewardPattern.rewardType(),
                    extractCaps(sentence),
                    ROTATING_PATTERN.matcher(sentence).find(),
                    INTRO_PATTERN.matcher(sentence).find(),
                    null,
                    null,
                    null
                ));
                break;
            }
        }
        return rules;
    }

    Set<String> extractCategories(String text) {
        Set<String> categories = new LinkedHashSet<>();
        String lowered = text.toLowerCase(Locale.ROOT);
        for (CategoryKeywordRule rule : CATEGORY_KEYWORD_RULES) {
            for (String keyword : rule.keywords()) {
                if (lowered.contains(keyword)) {
                    categories.add(rule.category());
                    break;
                }
            }
        }
        return categories;
    }

    private List<Cap> extractCaps(String sentence) {
        Matcher matcher = CAP_PATTERN.matcher(sentence);
        if (!matcher.find()) {
            return List.of();
        }
        double amount = Double.parseDouble(matcher.group(1).replace(",", ""));
        return List.of(new Cap(amount, CapPeriod.fromCode(matcher.group(2))));
    }

    private boolean isMarketingCopy(String sentence) {
        String lowered = " " + sentence.toLowerCase(Locale.ROOT) + " ";
        for (String phrase : SKIP_PHRASES) {
            if (lowered.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private record RewardPattern(RewardType rewardType, Pattern pattern) {
    }

    private record CategoryKeywordRule(String category, List<String> keywords) {
    }
}
