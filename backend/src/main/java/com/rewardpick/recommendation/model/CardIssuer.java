package com.rewardpick.recommendation.model;

public record CardIssuer(String name, String websiteUrl, String supportContact) {
}
