package com.rewardpick.catalog.service;

import java.util.List;

public class CatalogValidationException extends RuntimeException {

    private final List<String> violations;

    public CatalogValidationException(String source, List<String> violations) {
        super("Catalog from " + source + " rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
