package com.rewardpick.catalog.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog.refresh")
public class CatalogRefreshProperties {

    /**
     * Master switch for automatic refreshes. Manual refresh through the API always works.
     */
    private boolean enabled = true;

    /**
     * Load the catalog once the application is ready.
     */
    private boolean startupEnabled = true;

    /**
     * Reload the catalog on the cron schedule.
     */
    private boolean scheduledEnabled = false;

    /**
     * 6-field spring cron (second minute hour day month weekday)
     */
    private String cron = "0 0 4 * * *";

    private String zone = "UTC";

    /**
     * Spring resource prefix holding cards.json and rules.json.
     */
    private String location = "classpath:catalog/";
}
