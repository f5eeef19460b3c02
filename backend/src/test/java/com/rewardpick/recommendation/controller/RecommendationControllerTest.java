package com.rewardpick.recommendation.controller;

import static com.rewardpick.recommendation.CatalogFixtures.CHASE_UR;
import static com.rewardpick.recommendation.CatalogFixtures.categoryRule;
import static com.rewardpick.recommendation.CatalogFixtures.pointsCard;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rewardpick.common.GlobalExceptionHandler;
import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.CardScore;
import com.rewardpick.recommendation.model.ComputedRecommendation;
import com.rewardpick.recommendation.model.EarningRule;
import com.rewardpick.recommendation.model.RewardType;
import com.rewardpick.recommendation.service.RecommendationProperties;
import com.rewardpick.recommendation.service.RecommendationService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class RecommendationControllerTest {

    @Mock
    private RecommendationService recommendationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RecommendationProperties properties = new RecommendationProperties();
        mockMvc = MockMvcBuilders.standaloneSetup(new RecommendationController(recommendationService, properties))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void recommend_should_return_ranked_candidates() throws Exception {
        when(recommendationService.recommend("groceries", 3, false, 0.0)).thenReturn(groceryRecommendation());

        mockMvc.perform(get("/api/recommendations").param("query", "groceries").param("maxResults", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query").value("groceries"))
            .andExpect(jsonPath("$.resolvedCategories[0]").value("groceries"))
            .andExpect(jsonPath("$.candidates[0].rank").value(1))
            .andExpect(jsonPath("$.candidates[0].cardId").value("chase_sapphire_preferred"))
            .andExpect(jsonPath("$.candidates[0].rewardType").value("points_per_dollar"))
            .andExpect(jsonPath("$.candidates[0].effectiveRate").value(6.8))
            .andExpect(jsonPath("$.candidates[1].rank").value(2));
    }

    @Test
    void recommend_should_use_configured_default_max_results() throws Exception {
        when(recommendationService.recommend("groceries", 5, true, 250.0)).thenReturn(groceryRecommendation());

        mockMvc.perform(get("/api/recommendations")
                .param("query", "groceries")
                .param("includeBusiness", "true")
                .param("spendingAmount", "250"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.candidates.length()").value(2));
    }

    @Test
    void recommend_should_reject_blank_query() throws Exception {
        mockMvc.perform(get("/api/recommendations").param("query", "   "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("query is required"))
            .andExpect(jsonPath("$.path").value("/api/recommendations"));

        verify(recommendationService, never()).recommend(anyString(), anyInt(), anyBoolean(), anyDouble());
    }

    @Test
    void recommend_should_reject_out_of_range_max_results() throws Exception {
        mockMvc.perform(get("/api/recommendations").param("query", "gas").param("maxResults", "50"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("maxResults must be between 1 and 20"));
    }

    @Test
    void recommend_should_reject_negative_spending() throws Exception {
        mockMvc.perform(get("/api/recommendations").param("query", "gas").param("spendingAmount", "-10"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("spendingAmount must not be negative"));
    }

    @Test
    void recommend_should_reject_non_numeric_parameter() throws Exception {
        mockMvc.perform(get("/api/recommendations").param("query", "gas").param("maxResults", "many"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("maxResults")));
    }

    @Test
    void recommend_post_should_accept_json_body() throws Exception {
        when(recommendationService.recommend("groceries", 2, false, 0.0)).thenReturn(groceryRecommendation());

        mockMvc.perform(post("/api/recommendations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"groceries\",\"maxResults\":2}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.candidates[0].cardId").value("chase_sapphire_preferred"));
    }

    @Test
    void recommend_post_should_report_field_violations() throws Exception {
        mockMvc.perform(post("/api/recommendations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"\",\"maxResults\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Request validation failed"))
            .andExpect(jsonPath("$.details", hasItem(containsString("query"))))
            .andExpect(jsonPath("$.details", hasItem(containsString("maxResults"))));
    }

    @Test
    void recommendPerCard_should_return_one_candidate_per_card() throws Exception {
        when(recommendationService.recommendPerCard("gas", false, 0.0)).thenReturn(groceryRecommendation());

        mockMvc.perform(get("/api/recommendations/per-card").param("query", "gas"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.candidates[1].cardId").value("amex_gold"));
    }

    private ComputedRecommendation groceryRecommendation() {
        CardProduct sapphire = pointsCard("chase_sapphire_preferred", "Sapphire Preferred", CHASE_UR);
        CardProduct gold = pointsCard("amex_gold", "Gold", CHASE_UR);
        EarningRule sapphireRule = categoryRule("chase_sapphire_preferred", RewardType.POINTS_PER_DOLLAR, 4.0, "groceries");
        EarningRule goldRule = categoryRule("amex_gold", RewardType.POINTS_PER_DOLLAR, 3.0, "groceries");

        return new ComputedRecommendation(
            "groceries",
            List.of("groceries"),
            List.of(
                new CardScore(sapphire, sapphireRule, 6.800000001, "4x points on groceries", List.of()),
                new CardScore(gold, goldRule, 5.1, "3x points on groceries", List.of())
            ),
            "Best for groceries: Sapphire Preferred"
        );
    }
}
