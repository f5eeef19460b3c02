package com.rewardpick.recommendation.service;

import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.EarningRule;
import java.util.List;

public record ValuedMatch(CardProduct card, EarningRule rule, double adjustedRate, List<String> capNotes) {

    public ValuedMatch {
        capNotes = capNotes == null ? List.of() : List.copyOf(capNotes);
    }
}
