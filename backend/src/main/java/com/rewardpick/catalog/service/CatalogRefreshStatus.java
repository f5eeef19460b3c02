package com.rewardpick.catalog.service;

import java.time.OffsetDateTime;

/**
 * Outcome of the most recent catalog refreshes. {@code lastResult} is NEVER, SUCCESS or FAILURE.
 */
public record CatalogRefreshStatus(
    String lastResult,
    String lastTrigger,
    OffsetDateTime lastRunAt,
    OffsetDateTime lastSuccessAt,
    OffsetDateTime lastFailureAt,
    String lastMessage,
    Integer lastCards,
    Integer lastRules,
    Integer lastDanglingRules,
    int consecutiveFailureCount
) {

    public static final String NEVER = "NEVER";
    public static final String SUCCESS = "SUCCESS";
    public static final String FAILURE = "FAILURE";

    public static CatalogRefreshStatus never() {
        return new CatalogRefreshStatus(NEVER, "", null, null, null, "No catalog refresh has run yet", null, null, null, 0);
    }

    CatalogRefreshStatus success(String trigger, OffsetDateTime runAt, CatalogBatch batch) {
        return new CatalogRefreshStatus(
            SUCCESS,
            trigger,
            runAt,
            runAt,
            lastFailureAt,
            "Catalog refresh completed",
            batch.cards().size(),
            batch.rules().size(),
            batch.danglingRules(),
            0
        );
    }

    CatalogRefreshStatus failure(String trigger, OffsetDateTime runAt, String message) {
        return new CatalogRefreshStatus(
            FAILURE,
            trigger,
            runAt,
            lastSuccessAt,
            runAt,
            message,
            null,
            null,
            null,
            consecutiveFailureCount + 1
        );
    }
}
