package com.rewardpick.recommendation.model;

public record RuleMatch(CardProduct card, EarningRule rule) {
}
