package com.rewardpick.recommendation.model;

import java.util.Locale;

public enum RewardType {

    CASHBACK_PERCENT("cashback_percent"),
    POINTS_PER_DOLLAR("points_per_dollar"),
    MILES_PER_DOLLAR("miles_per_dollar"),
    HYBRID("hybrid");

    private final String code;

    RewardType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RewardType fromCode(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (RewardType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown reward type: " + value);
    }
}
