package com.rewardpick.catalog.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rewardpick.catalog.document.CardDocument;
import com.rewardpick.catalog.document.CatalogDocument;
import com.rewardpick.catalog.document.RuleDocument;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads {@code cards.json} and {@code rules.json}, each a top-level JSON array, from a Spring
 * resource location such as {@code classpath:catalog/} or {@code file:/var/lib/rewardpick/}.
 * The cards file is required; a missing rules file means cards carry their rules as
 * {@code reward_text}.
 */
public class JsonCatalogSource implements CatalogSource {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalogSource.class);

    static final String CARDS_FILE = "cards.json";
    static final String RULES_FILE = "rules.json";

    private static final TypeReference<List<CardDocument>> CARD_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<RuleDocument>> RULE_LIST = new TypeReference<>() {
    };

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public JsonCatalogSource(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = normalizeLocation(location);
    }

    @Override
    public String name() {
        return "json:" + location;
    }

    @Override
    public CatalogDocument load() {
        Resource cardsResource = resourceLoader.getResource(location + CARDS_FILE);
        if (!cardsResource.exists()) {
            throw new UncheckedIOException(new IOException("Catalog file not found: " + location + CARDS_FILE));
        }

        List<CardDocument> cards = read(cardsResource, CARD_LIST);

        Resource rulesResource = resourceLoader.getResource(location + RULES_FILE);
        List<RuleDocument> rules = List.of();
        if (rulesResource.exists()) {
            rules = read(rulesResource, RULE_LIST);
        } else {
            log.info("Catalog rules file absent, using card reward text only (location={})", location);
        }

        return new CatalogDocument(name(), cards, rules);
    }

    private <T> List<T> read(Resource resource, TypeReference<List<T>> type) {
        try (InputStream input = resource.getInputStream()) {
            List<T> values = objectMapper.readValue(input, type);
            return values == null ? List.of() : values;
        } catch (IOException exception) {
            throw new UncheckedIOException("Failed to read catalog file " + resource.getDescription(), exception);
        }
    }

    private static String normalizeLocation(String location) {
        String value = location == null || location.isBlank() ? "classpath:catalog/" : location.trim();
        return value.endsWith("/") ? value : value + "/";
    }
}
