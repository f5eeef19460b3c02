package com.rewardpick.catalog.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class CatalogSourceConfig {

    @Bean
    public JsonCatalogSource jsonCatalogSource(
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper,
        CatalogRefreshProperties properties
    ) {
        return new JsonCatalogSource(resourceLoader, objectMapper, properties.getLocation());
    }
}
