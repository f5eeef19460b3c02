package com.rewardpick.catalog.service;

import com.rewardpick.catalog.document.CatalogDocument;
import com.rewardpick.recommendation.model.CatalogSnapshot;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Loads every configured source, validates the merged content and swaps it in as the current
 * snapshot. A failed refresh keeps serving the previous snapshot.
 */
@Service
public class CatalogRefreshService {

    private static final Logger log = LoggerFactory.getLogger(CatalogRefreshService.class);

    private final List<CatalogSource> sources;
    private final CatalogValidator catalogValidator;
    private final CatalogSnapshotHolder snapshotHolder;
    private final AtomicReference<CatalogRefreshStatus> status = new AtomicReference<>(CatalogRefreshStatus.never());

    public CatalogRefreshService(
        List<CatalogSource> sources,
        CatalogValidator catalogValidator,
        CatalogSnapshotHolder snapshotHolder
    ) {
        this.sources = List.copyOf(sources);
        this.catalogValidator = catalogValidator;
        this.snapshotHolder = snapshotHolder;
    }

    public CatalogSnapshot refresh(String trigger) {
        OffsetDateTime runAt = OffsetDateTime.now();

        try {
            if (sources.isEmpty()) {
                throw new IllegalStateException("No catalog source is configured");
            }

            List<CatalogDocument> documents = new ArrayList<>();
            for (CatalogSource source : sources) {
                documents.add(source.load());
            }

            CatalogBatch batch = catalogValidator.validate(CatalogDocument.merge(documents));
            CatalogSnapshot snapshot = new CatalogSnapshot(batch.cards(), batch.rules(), null, batch.source(), Instant.now());
            snapshotHolder.replace(snapshot);

            markSuccess(trigger, runAt, batch);
            log.info(
                "Catalog refresh completed (trigger={}, source={}, cards={}, rules={}, dangling={})",
                trigger,
                batch.source(),
                batch.cards().size(),
                batch.rules().size(),
                batch.danglingRules()
            );
            return snapshot;
        } catch (RuntimeException exception) {
            markFailure(trigger, runAt, rootMessage(exception));
            throw exception;
        }
    }

    public CatalogRefreshStatus getStatus() {
        return status.get();
    }

    public CatalogSnapshot currentSnapshot() {
        return snapshotHolder.current();
    }

    private void markSuccess(String trigger, OffsetDateTime runAt, CatalogBatch batch) {
        status.updateAndGet(previous -> previous.success(trigger, runAt, batch));
    }

    private void markFailure(String trigger, OffsetDateTime runAt, String message) {
        status.updateAndGet(previous -> previous.failure(trigger, runAt, message));
    }

    private String rootMessage(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor.getCause() != null) {
            cursor = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getMessage();
        }
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message;
    }
}
