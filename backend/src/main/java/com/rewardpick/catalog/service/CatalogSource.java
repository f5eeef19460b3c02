package com.rewardpick.catalog.service;

import com.rewardpick.catalog.document.CatalogDocument;

/**
 * Somewhere card and rule documents come from. Implementations throw unchecked exceptions when
 * the source cannot be read.
 */
public interface CatalogSource {

    String name();

    CatalogDocument load();
}
