package com.rewardpick.recommendation.service;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecommendationConfig {

    @Bean
    public CategoryDictionary categoryDictionary() {
        return CategoryDictionary.defaults();
    }

    @Bean
    public PointValuationTable pointValuationTable(RecommendationProperties properties) {
        return PointValuationTable.from(properties);
    }
}
