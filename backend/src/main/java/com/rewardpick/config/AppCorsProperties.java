package com.rewardpick.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * CORS settings for the {@code /api/**} endpoints. Empty lists fall back to the local frontend
 * dev server and read-plus-refresh methods.
 */
@ConfigurationProperties(prefix = "app.cors")
public record AppCorsProperties(List<String> allowedOrigins, List<String> allowedMethods) {

    public AppCorsProperties {
        allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
            ? List.of("http://localhost:5173")
            : List.copyOf(allowedOrigins);
        allowedMethods = allowedMethods == null || allowedMethods.isEmpty()
            ? List.of("GET", "POST", "OPTIONS")
            : List.copyOf(allowedMethods);
    }
}
