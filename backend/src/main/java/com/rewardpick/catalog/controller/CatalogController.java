package com.rewardpick.catalog.controller;

import com.rewardpick.catalog.dto.CardResponse;
import com.rewardpick.catalog.dto.CatalogRefreshResponse;
import com.rewardpick.catalog.dto.CatalogStatsResponse;
import com.rewardpick.catalog.dto.CatalogStatusResponse;
import com.rewardpick.catalog.service.CatalogRefreshService;
import com.rewardpick.catalog.service.CatalogSummaryService;
import com.rewardpick.recommendation.model.CatalogSnapshot;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {

    private static final String MANUAL_TRIGGER = "manual-api";

    private final CatalogSummaryService catalogSummaryService;
    private final CatalogRefreshService catalogRefreshService;

    public CatalogController(CatalogSummaryService catalogSummaryService, CatalogRefreshService catalogRefreshService) {
        this.catalogSummaryService = catalogSummaryService;
        this.catalogRefreshService = catalogRefreshService;
    }

    @GetMapping("/cards")
    public List<CardResponse> getCards(
        @RequestParam(name = "includeBusiness", defaultValue = "true") boolean includeBusiness
    ) {
        return catalogSummaryService.getCards(includeBusiness);
    }

    @GetMapping("/stats")
    public CatalogStatsResponse getStats() {
        return catalogSummaryService.getStats();
    }

    @GetMapping("/status")
    public CatalogStatusResponse getStatus() {
        return catalogSummaryService.getStatus();
    }

    @PostMapping("/refresh")
    public CatalogRefreshResponse refresh() {
        CatalogSnapshot snapshot = catalogRefreshService.refresh(MANUAL_TRIGGER);
        return new CatalogRefreshResponse(
            MANUAL_TRIGGER,
            snapshot.source(),
            snapshot.cards().size(),
            snapshot.rules().size(),
            catalogRefreshService.getStatus().lastDanglingRules(),
            snapshot.loadedAt()
        );
    }
}
