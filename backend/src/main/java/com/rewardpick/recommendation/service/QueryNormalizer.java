package com.rewardpick.recommendation.service;

import com.rewardpick.recommendation.model.MerchantMapping;
import com.rewardpick.recommendation.model.QueryResolution;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns a free-text merchant or category query into a {@link QueryResolution}.
 *
 * <p>Resolution order: a bare 4-digit merchant category code, then known merchant (key, then key
 * containment, then aliases), then category synonym, then the cleaned query itself as a synthetic
 * category. Table order breaks ties.
 *
 * <p>Containment is a plain substring test unless word-boundary matching is enabled, in which
 * case a phrase must start and end on word boundaries ("gas" no longer hits "vegas").
 */
@Component
public class QueryNormalizer {

    private static final List<String> NOISE_SUFFIXES = List.of(
        ".com",
        " gas stations",
        " gas station",
        " supercenter",
        " stores",
        " store",
        " shop",
        " inc",
        " llc"
    );

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.,;:!?]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern MCC_CODE = Pattern.compile("[0-9]{4}");

    private final CategoryDictionary dictionary;
    private final boolean wordBoundaryMatching;

    public QueryNormalizer(CategoryDictionary dictionary, RecommendationProperties properties) {
        this.dictionary = dictionary;
        this.wordBoundaryMatching = properties.isWordBoundaryMatching();
    }

    public QueryResolution normalize(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }

        String lowered = query.trim().toLowerCase(Locale.ROOT);
        String cleaned = stripNoise(lowered);

        if (MCC_CODE.matcher(cleaned).matches()) {
            return resolveMcc(query, cleaned);
        }

        Optional<MerchantMapping> merchant = findMerchant(lowered, cleaned);
        if (merchant.isPresent()) {
            MerchantMapping mapping = merchant.get();
            return new QueryResolution(
                query,
                mapping.merchantName(),
                mapping.mcc(),
                new LinkedHashSet<>(mapping.categories()),
                true
            );
        }

        String category = normalizeCategoryName(lowered, cleaned);
        return new QueryResolution(query, query.trim(), null, Set.of(category), false);
    }

    /**
     * Codes missing from the MCC table keep the code itself as their only category, so rules
     * listing that MCC still match.
     */
    private QueryResolution resolveMcc(String query, String mcc) {
        List<String> categories = dictionary.categoriesForMcc(mcc);
        Set<String> resolved = categories.isEmpty() ? Set.of(mcc) : new LinkedHashSet<>(categories);
        return new QueryResolution(query, query.trim(), mcc, resolved, false);
    }

    public List<String> categoriesForMcc(String mcc) {
        return dictionary.categoriesForMcc(mcc);
    }

    /**
     * Maps a raw category phrase ("US Supermarkets", "grocery stores") to its canonical name.
     */
    public String normalizeCategoryName(String category) {
        String lowered = category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
        return normalizeCategoryName(lowered, stripNoise(lowered));
    }

    String stripNoise(String lowered) {
        String current = TRAILING_PUNCTUATION.matcher(lowered).replaceAll("");
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String suffix : NOISE_SUFFIXES) {
                if (current.endsWith(suffix) && current.length() > suffix.length()) {
                    String candidate = TRAILING_PUNCTUATION.matcher(
                        current.substring(0, current.length() - suffix.length())
                    ).replaceAll("");
                    if (!candidate.isBlank()) {
                        current = candidate;
                        stripped = true;
                        break;
                    }
                }
            }
        }
        return current.isBlank() ? lowered : current;
    }

    private Optional<MerchantMapping> findMerchant(String lowered, String cleaned) {
        for (MerchantMapping merchant : dictionary.merchants()) {
            String key = merchant.key();
            if (key.equals(lowered) || key.equals(cleaned) || containsPhrase(lowered, key)) {
                return Optional.of(merchant);
            }
            for (String alias : merchant.aliases()) {
                if (alias.equals(lowered) || alias.equals(cleaned) || containsPhrase(lowered, alias)) {
                    return Optional.of(merchant);
                }
            }
        }
        return Optional.empty();
    }

    private String normalizeCategoryName(String lowered, String cleaned) {
        Map<String, List<String>> synonyms = dictionary.categorySynonyms();

        // exact matches first, over the whole table
        for (Map.Entry<String, List<String>> entry : synonyms.entrySet()) {
            if (isExact(entry, cleaned) || isExact(entry, lowered)) {
                return entry.getKey();
            }
        }

        for (Map.Entry<String, List<String>> entry : synonyms.entrySet()) {
            for (String synonym : entry.getValue()) {
                if (containsPhrase(lowered, synonym)) {
                    return entry.getKey();
                }
            }
        }

        return WHITESPACE.matcher(cleaned).replaceAll("_");
    }

    private boolean isExact(Map.Entry<String, List<String>> entry, String text) {
        return entry.getKey().equals(text) || entry.getValue().contains(text);
    }

    private boolean containsPhrase(String text, String phrase) {
        if (phrase.isEmpty()) {
            return false;
        }
        if (!wordBoundaryMatching) {
            return text.contains(phrase);
        }

        int from = 0;
        while (true) {
            int index = text.indexOf(phrase, from);
            if (index < 0) {
                return false;
            }
            int end = index + phrase.length();
            boolean startsOnBoundary = index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1));
            boolean endsOnBoundary = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (startsOnBoundary && endsOnBoundary) {
                return true;
            }
            from = index + 1;
        }
    }
}
