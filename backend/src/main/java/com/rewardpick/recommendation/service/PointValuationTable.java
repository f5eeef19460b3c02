package com.rewardpick.recommendation.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Cents-per-point assumptions keyed by upper-cased reward program id. Built once and validated
 * up front so lookups never meet a malformed entry.
 */
public final class PointValuationTable {

    private final Map<String, Double> centsByProgram;
    private final double defaultCents;

    public PointValuationTable(Map<String, Double> centsByProgram, double defaultCents) {
        requireValidValue("default point value", defaultCents);

        Map<String, Double> normalized = new LinkedHashMap<>();
        if (centsByProgram != null) {
            for (Map.Entry<String, Double> entry : centsByProgram.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().trim().toUpperCase(Locale.ROOT);
                if (key.isEmpty()) {
                    throw new IllegalArgumentException("Point value table contains a blank program id");
                }
                Double value = entry.getValue();
                if (value == null) {
                    throw new IllegalArgumentException("Point value for " + key + " is missing");
                }
                requireValidValue("point value for " + key, value);
                if (normalized.put(key, value) != null) {
                    throw new IllegalArgumentException("Point value table lists " + key + " twice");
                }
            }
        }

        this.centsByProgram = Collections.unmodifiableMap(normalized);
        this.defaultCents = defaultCents;
    }

    public static PointValuationTable from(RecommendationProperties properties) {
        return new PointValuationTable(properties.getPointValues(), properties.getDefaultPointValueCents());
    }

    public OptionalDouble lookup(String programId) {
        if (programId == null) {
            return OptionalDouble.empty();
        }
        Double value = centsByProgram.get(programId.trim().toUpperCase(Locale.ROOT));
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public double defaultCents() {
        return defaultCents;
    }

    public Map<String, Double> entries() {
        return centsByProgram;
    }

    private static void requireValidValue(String label, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new IllegalArgumentException("Invalid " + label + ": " + value);
        }
    }
}
