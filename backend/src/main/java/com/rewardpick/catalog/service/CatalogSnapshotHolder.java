package com.rewardpick.catalog.service;

import com.rewardpick.recommendation.model.CatalogSnapshot;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Current catalog snapshot. Readers take one reference per request and never observe a
 * half-replaced catalog.
 */
@Component
public class CatalogSnapshotHolder {

    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>(CatalogSnapshot.empty());

    public CatalogSnapshot current() {
        return current.get();
    }

    public CatalogSnapshot replace(CatalogSnapshot snapshot) {
        return current.getAndSet(Objects.requireNonNull(snapshot, "snapshot must not be null"));
    }
}
