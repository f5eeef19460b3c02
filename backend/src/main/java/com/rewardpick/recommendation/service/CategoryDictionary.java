package com.rewardpick.recommendation.service;

import com.rewardpick.recommendation.model.MerchantMapping;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lookup tables behind query normalization: category synonyms, known merchants and MCC
 * categories. Declaration order is significant, the first matching entry wins.
 */
public final class CategoryDictionary {

    private static final Pattern MCC_PATTERN = Pattern.compile("[0-9]{4}");
    private static final Pattern CATEGORY_PATTERN = Pattern.compile("[a-z0-9_]+");

    private final Map<String, List<String>> categorySynonyms;
    private final List<MerchantMapping> merchants;
    private final Map<String, List<String>> mccCategories;

    public CategoryDictionary(
        Map<String, List<String>> categorySynonyms,
        List<MerchantMapping> merchants,
        Map<String, List<String>> mccCategories
    ) {
        List<String> violations = new ArrayList<>();

        this.categorySynonyms = freezeSynonyms(categorySynonyms, violations);
        this.merchants = freezeMerchants(merchants, violations);
        this.mccCategories = freezeMccCategories(mccCategories, violations);

        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("Invalid category dictionary: " + String.join("; ", violations));
        }
    }

    public static CategoryDictionary defaults() {
        return new CategoryDictionary(buildCategorySynonyms(), buildKnownMerchants(), buildMccCategories());
    }

    public Map<String, List<String>> categorySynonyms() {
        return categorySynonyms;
    }

    public List<MerchantMapping> merchants() {
        return merchants;
    }

    public List<String> categoriesForMcc(String mcc) {
        if (mcc == null) {
            return List.of();
        }
        return mccCategories.getOrDefault(mcc.trim(), List.of());
    }

    private static Map<String, List<String>> freezeSynonyms(Map<String, List<String>> source, List<String> violations) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        if (source == null || source.isEmpty()) {
            violations.add("category synonym table is empty");
            return Collections.unmodifiableMap(frozen);
        }

        source.forEach((category, synonyms) -> {
            if (!isCategory(category)) {
                violations.add("bad category key '" + category + "'");
                return;
            }
            List<String> phrases = new ArrayList<>();
            if (synonyms != null) {
                for (String synonym : synonyms) {
                    if (synonym == null || synonym.isBlank() || !synonym.equals(synonym.trim().toLowerCase(Locale.ROOT))) {
                        violations.add("bad synonym '" + synonym + "' for " + category);
                    } else {
                        phrases.add(synonym);
                    }
                }
            }
            frozen.put(category, List.copyOf(phrases));
        });
        return Collections.unmodifiableMap(frozen);
    }

    private static List<MerchantMapping> freezeMerchants(List<MerchantMapping> source, List<String> violations) {
        if (source == null) {
            return List.of();
        }
        for (MerchantMapping merchant : source) {
            if (!merchant.key().equals(merchant.key().trim().toLowerCase(Locale.ROOT)) || merchant.key().isBlank()) {
                violations.add("merchant key '" + merchant.key() + "' must be trimmed lower-case text");
            }
            if (merchant.categories().isEmpty()) {
                violations.add("merchant '" + merchant.key() + "' has no categories");
            }
            merchant.categories().stream()
                .filter(category -> !isCategory(category))
                .forEach(category -> violations.add("merchant '" + merchant.key() + "' has bad category '" + category + "'"));
            if (merchant.mcc() != null && !MCC_PATTERN.matcher(merchant.mcc()).matches()) {
                violations.add("merchant '" + merchant.key() + "' has bad MCC '" + merchant.mcc() + "'");
            }
            merchant.aliases().stream()
                .filter(alias -> alias == null || alias.isBlank() || !alias.equals(alias.trim().toLowerCase(Locale.ROOT)))
                .forEach(alias -> violations.add("merchant '" + merchant.key() + "' has bad alias '" + alias + "'"));
        }
        return List.copyOf(source);
    }

    private static Map<String, List<String>> freezeMccCategories(Map<String, List<String>> source, List<String> violations) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        if (source == null) {
            return Collections.unmodifiableMap(frozen);
        }
        source.forEach((mcc, categories) -> {
            if (mcc == null || !MCC_PATTERN.matcher(mcc).matches()) {
                violations.add("bad MCC key '" + mcc + "'");
                return;
            }
            if (categories == null || categories.isEmpty() || !categories.stream().allMatch(CategoryDictionary::isCategory)) {
                violations.add("MCC " + mcc + " needs one or more valid categories");
                return;
            }
            frozen.put(mcc, List.copyOf(categories));
        });
        return Collections.unmodifiableMap(frozen);
    }

    private static boolean isCategory(String value) {
        return value != null && CATEGORY_PATTERN.matcher(value).matches();
    }

    private static Map<String, List<String>> buildCategorySynonyms() {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();

        putSynonyms(synonyms, "groceries",
            "grocery", "supermarket", "supermarkets", "grocery store", "grocery stores",
            "food store", "food stores", "market", "markets", "food market",
            "grocery shopping", "food shopping", "supermarket shopping");
        putSynonyms(synonyms, "gas",
            "gas station", "gas stations", "fuel", "gasoline", "petrol", "petrol station",
            "filling station", "service station", "fuel station", "gas pump");
        putSynonyms(synonyms, "restaurants",
            "restaurant", "dining", "dine", "food", "fast food", "fast-food", "fastfood",
            "cafe", "café", "coffee shop", "coffeehouse", "bistro", "eatery", "diner",
            "casual dining", "fine dining", "takeout", "take-out", "delivery");
        putSynonyms(synonyms, "travel",
            "travel", "trip", "trips", "vacation", "vacations", "tourism", "tourist",
            "airline", "airlines", "flight", "flights", "airport", "hotel", "hotels",
            "lodging", "accommodation", "resort", "resorts", "cruise", "cruises",
            "car rental", "car rentals", "rental car", "train", "trains", "railway");
        putSynonyms(synonyms, "online_shopping",
            "online", "e-commerce", "internet shopping", "online store", "online stores",
            "web shopping", "internet purchase", "online purchase", "ecommerce");
        putSynonyms(synonyms, "department_store",
            "department store", "department stores", "retail store", "retail stores");
        putSynonyms(synonyms, "wholesale",
            "wholesale club", "warehouse", "warehouse club", "warehouse store",
            "bulk store", "membership warehouse");
        putSynonyms(synonyms, "streaming",
            "streaming", "streaming service", "streaming services", "netflix", "spotify",
            "hulu", "disney+", "disney plus", "apple music", "youtube premium",
            "prime video", "hbo", "hbo max", "paramount+", "paramount plus");
        putSynonyms(synonyms, "utilities",
            "utility", "utilities", "phone", "internet", "cable", "electricity", "electric",
            "water", "gas utility", "internet service", "phone service", "cable service",
            "cell phone", "mobile phone", "wireless", "internet provider");
        putSynonyms(synonyms, "pharmacy",
            "pharmacy", "pharmacies", "drugstore", "drug stores", "cvs", "walgreens",
            "rite aid", "prescription", "prescriptions", "medication", "medications");
        putSynonyms(synonyms, "entertainment",
            "entertainment", "movies", "movie", "cinema", "theater", "theatre",
            "concert", "concerts", "sports", "sporting event", "sporting events",
            "amusement park", "theme park", "bowling", "golf", "sports bar");
        putSynonyms(synonyms, "shopping",
            "shopping", "retail", "store", "stores", "merchant", "merchants",
            "purchase", "purchases", "buy", "buying");
        putSynonyms(synonyms, "transit",
            "transit", "public transit", "public transportation", "metro", "subway",
            "bus", "buses", "uber", "lyft", "rideshare", "ride share", "taxi", "taxis");

        return synonyms;
    }

    private static List<MerchantMapping> buildKnownMerchants() {
        return List.of(
            merchant("macy's", "Macy's", "5311", List.of("department_store"), "macys", "macy", "macy's"),
            merchant("amazon", "Amazon", "5999", List.of("online_shopping", "general_merchandise"), "amazon.com", "amzn"),
            merchant("costco", "Costco", "5300", List.of("wholesale", "groceries"), "costco wholesale"),
            merchant("walmart", "Walmart", "5331", List.of("general_merchandise", "groceries"), "walmart supercenter", "walmart.com"),
            merchant("target", "Target", "5331", List.of("general_merchandise", "groceries"), "target.com"),
            merchant("kroger", "Kroger", "5411", List.of("groceries"), "kroger grocery", "kroger.com"),
            merchant("whole foods", "Whole Foods", "5411", List.of("groceries"), "whole foods market", "wholefoods"),
            merchant("delta", "Delta Airlines", "4511", List.of("travel", "airline"), "delta air lines", "delta.com"),
            merchant("united", "United Airlines", "4511", List.of("travel", "airline"), "united airlines", "united.com"),
            merchant("american airlines", "American Airlines", "4511", List.of("travel", "airline"), "aa.com", "american"),
            merchant("marriott", "Marriott", "7011", List.of("travel", "hotel"), "marriott bonvoy", "marriott.com"),
            merchant("shell", "Shell", "5541", List.of("gas"), "shell oil"),
            merchant("exxon", "Exxon", "5541", List.of("gas"), "exxonmobil"),
            merchant("starbucks", "Starbucks", "5814", List.of("restaurants"), "sbux"),
            merchant("cvs", "CVS Pharmacy", "5912", List.of("pharmacy"), "cvs pharmacy"),
            merchant("walgreens", "Walgreens", "5912", List.of("pharmacy"), "walgreens.com")
        );
    }

    private static Map<String, List<String>> buildMccCategories() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("5411", List.of("groceries"));
        categories.put("5541", List.of("gas"));
        categories.put("5542", List.of("gas"));
        categories.put("5812", List.of("restaurants"));
        categories.put("5814", List.of("restaurants"));
        categories.put("5311", List.of("department_store"));
        categories.put("5331", List.of("general_merchandise"));
        categories.put("5300", List.of("wholesale"));
        categories.put("4511", List.of("travel", "airline"));
        categories.put("7011", List.of("travel", "hotel"));
        categories.put("5999", List.of("online_shopping"));
        categories.put("5912", List.of("pharmacy"));
        return categories;
    }

    private static void putSynonyms(Map<String, List<String>> synonyms, String category, String... phrases) {
        synonyms.put(category, List.of(phrases));
    }

    private static MerchantMapping merchant(
        String key,
        String merchantName,
        String mcc,
        List<String> categories,
        String... aliases
    ) {
        return new MerchantMapping(key, merchantName, mcc, categories, List.of(aliases));
    }
}
