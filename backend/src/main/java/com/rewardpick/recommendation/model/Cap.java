package com.rewardpick.recommendation.model;

import java.util.Objects;

/**
 * Spending limit after which a bonus rate stops applying.
 */
public record Cap(double amountDollars, CapPeriod period, String description) {

    public Cap {
        Objects.requireNonNull(period, "cap period must not be null");
    }

    public Cap(double amountDollars, CapPeriod period) {
        this(amountDollars, period, null);
    }
}
