package com.rewardpick.recommendation.service;

import java.util.List;

/**
 * Effective rate after spending caps, with the notes explaining the adjustment.
 */
public record CapAdjustment(double rate, List<String> notes) {

    public CapAdjustment {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static CapAdjustment unchanged(double rate) {
        return new CapAdjustment(rate, List.of());
    }
}
