package com.rewardpick.recommendation.model;

import java.util.Locale;

public enum CardNetwork {

    VISA("visa"),
    MASTERCARD("mastercard"),
    AMEX("amex"),
    DISCOVER("discover");

    private final String code;

    CardNetwork(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CardNetwork fromCode(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (CardNetwork network : values()) {
            if (network.code.equals(normalized)) {
                return network;
            }
        }
        throw new IllegalArgumentException("Unknown card network: " + value);
    }
}
