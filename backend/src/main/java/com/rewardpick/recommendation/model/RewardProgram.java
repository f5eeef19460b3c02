package com.rewardpick.recommendation.model;

/**
 * A point or mile currency. {@code basePointValueCents} is the program's own valuation,
 * used when the configured valuation table has no entry for {@code id}.
 */
public record RewardProgram(String id, String name, double basePointValueCents, String notes) {
}
