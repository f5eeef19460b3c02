package com.rewardpick.recommendation.controller;

import com.rewardpick.recommendation.dto.CardScoreResponse;
import com.rewardpick.recommendation.dto.RecommendationRequest;
import com.rewardpick.recommendation.dto.RecommendationResponse;
import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.CardScore;
import com.rewardpick.recommendation.model.ComputedRecommendation;
import com.rewardpick.recommendation.service.RecommendationProperties;
import com.rewardpick.recommendation.service.RecommendationService;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {

    private static final int MAX_RESULTS_LIMIT = 20;

    private final RecommendationService recommendationService;
    private final RecommendationProperties properties;

    public RecommendationController(RecommendationService recommendationService, RecommendationProperties properties) {
        this.recommendationService = recommendationService;
        this.properties = properties;
    }

    @GetMapping
    public RecommendationResponse recommend(
        @RequestParam(name = "query", required = false) String query,
        @RequestParam(name = "maxResults", required = false) Integer maxResults,
        @RequestParam(name = "includeBusiness", defaultValue = "false") boolean includeBusiness,
        @RequestParam(name = "spendingAmount", defaultValue = "0") double spendingAmount
    ) {
        return toResponse(recommendationService.recommend(
            requireQuery(query),
            normalizeMaxResults(maxResults),
            includeBusiness,
            requireSpending(spendingAmount)
        ));
    }

    @PostMapping
    public RecommendationResponse recommend(@Valid @RequestBody RecommendationRequest request) {
        return toResponse(recommendationService.recommend(
            request.query(),
            normalizeMaxResults(request.maxResults()),
            Boolean.TRUE.equals(request.includeBusiness()),
            request.spendingAmount() == null ? 0.0 : request.spendingAmount()
        ));
    }

    @GetMapping("/per-card")
    public RecommendationResponse recommendPerCard(
        @RequestParam(name = "query", required = false) String query,
        @RequestParam(name = "includeBusiness", defaultValue = "false") boolean includeBusiness,
        @RequestParam(name = "spendingAmount", defaultValue = "0") double spendingAmount
    ) {
        return toResponse(recommendationService.recommendPerCard(
            requireQuery(query),
            includeBusiness,
            requireSpending(spendingAmount)
        ));
    }

    private String requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query is required");
        }
        return query;
    }

    private int normalizeMaxResults(Integer maxResults) {
        if (maxResults == null) {
            return properties.getMaxResults();
        }
        if (maxResults < 1 || maxResults > MAX_RESULTS_LIMIT) {
            throw new ResponseStatusException(
                HttpStatus.BAD_REQUEST,
                "maxResults must be between 1 and " + MAX_RESULTS_LIMIT
            );
        }
        return maxResults;
    }

    private double requireSpending(double spendingAmount) {
        if (spendingAmount < 0 || !Double.isFinite(spendingAmount)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "spendingAmount must not be negative");
        }
        return spendingAmount;
    }

    private RecommendationResponse toResponse(ComputedRecommendation recommendation) {
        List<CardScoreResponse> candidates = new ArrayList<>();
        int rank = 1;
        for (CardScore score : recommendation.candidates()) {
            candidates.add(toCardScoreResponse(rank++, score));
        }
        return new RecommendationResponse(
            recommendation.query(),
            recommendation.resolvedCategories(),
            candidates,
            recommendation.explanation()
        );
    }

    private CardScoreResponse toCardScoreResponse(int rank, CardScore score) {
        CardProduct card = score.card();
        return new CardScoreResponse(
            rank,
            card.id(),
            card.name(),
            card.issuer() == null ? null : card.issuer().name(),
            card.network() == null ? null : card.network().code(),
            score.rule().rewardType().code(),
            card.annualFee(),
            card.businessCard(),
            card.officialUrl(),
            score.rule().description(),
            score.rule().multiplier(),
            roundRate(score.effectiveRate()),
            score.explanation(),
            score.notes()
        );
    }

    private double roundRate(double rate) {
        return Math.round(rate * 10000.0) / 10000.0;
    }
}
