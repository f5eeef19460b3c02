package com.rewardpick.catalog.service;

import com.rewardpick.catalog.dto.CardResponse;
import com.rewardpick.catalog.dto.CatalogStatsResponse;
import com.rewardpick.catalog.dto.CatalogStatusResponse;
import com.rewardpick.recommendation.model.CardProduct;
import com.rewardpick.recommendation.model.CatalogSnapshot;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import org.springframework.stereotype.Service;

@Service
public class CatalogSummaryService {

    private static final String UNKNOWN = "unknown";

    private final CatalogSnapshotHolder snapshotHolder;
    private final CatalogRefreshService catalogRefreshService;

    public CatalogSummaryService(CatalogSnapshotHolder snapshotHolder, CatalogRefreshService catalogRefreshService) {
        this.snapshotHolder = snapshotHolder;
        this.catalogRefreshService = catalogRefreshService;
    }

    public List<CardResponse> getCards(boolean includeBusiness) {
        return snapshotHolder.current().cards().stream()
            .filter(card -> includeBusiness || !card.businessCard())
            .map(this::toCardResponse)
            .toList();
    }

    public CatalogStatsResponse getStats() {
        CatalogSnapshot snapshot = snapshotHolder.current();
        List<CardProduct> cards = snapshot.cards();

        return new CatalogStatsResponse(
            cards.size(),
            snapshot.rules().size(),
            (int) cards.stream().filter(CardProduct::businessCard).count(),
            countBy(cards, card -> card.issuer() == null ? null : card.issuer().name()),
            countBy(cards, card -> card.network() == null ? null : card.network().code()),
            countBy(cards, card -> card.rewardType().code())
        );
    }

    public CatalogStatusResponse getStatus() {
        CatalogSnapshot snapshot = snapshotHolder.current();
        return new CatalogStatusResponse(
            OffsetDateTime.now(),
            snapshot.source(),
            snapshot.cards().size(),
            snapshot.rules().size(),
            snapshot.loadedAt(),
            catalogRefreshService.getStatus()
        );
    }

    private Map<String, Integer> countBy(List<CardProduct> cards, Function<CardProduct, String> classifier) {
        Map<String, Integer> counts = new TreeMap<>();
        for (CardProduct card : cards) {
            String key = classifier.apply(card);
            counts.merge(key == null || key.isBlank() ? UNKNOWN : key, 1, Integer::sum);
        }
        return counts;
    }

    private CardResponse toCardResponse(CardProduct card) {
        return new CardResponse(
            card.id(),
            card.name(),
            card.issuer() == null ? null : card.issuer().name(),
            card.network() == null ? null : card.network().code(),
            card.rewardType().code(),
            card.annualFee(),
            card.foreignTransactionFee(),
            card.rewardProgram() == null ? null : card.rewardProgram().id(),
            card.businessCard(),
            card.officialUrl()
        );
    }
}
