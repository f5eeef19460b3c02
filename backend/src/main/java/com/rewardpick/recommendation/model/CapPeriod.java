package com.rewardpick.recommendation.model;

import java.util.Locale;

public enum CapPeriod {

    MONTH("month"),
    QUARTER("quarter"),
    YEAR("year"),
    LIFETIME("lifetime");

    private final String code;

    CapPeriod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CapPeriod fromCode(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (CapPeriod period : values()) {
            if (period.code.equals(normalized)) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unknown cap period: " + value);
    }
}
