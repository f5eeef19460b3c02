package com.rewardpick.catalog.service;

import com.rewardpick.recommendation.model.CatalogSnapshot;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CatalogRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(CatalogRefreshScheduler.class);

    private final CatalogRefreshService catalogRefreshService;
    private final CatalogRefreshProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CatalogRefreshScheduler(CatalogRefreshService catalogRefreshService, CatalogRefreshProperties properties) {
        this.catalogRefreshService = catalogRefreshService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void runAtStartup() {
        if (!properties.isEnabled() || !properties.isStartupEnabled()) {
            log.info("Catalog startup refresh skipped (enabled={}, startupEnabled={})", properties.isEnabled(), properties.isStartupEnabled());
            return;
        }
        runRefresh("startup");
    }

    @Scheduled(cron = "#{@catalogRefreshProperties.cron}", zone = "#{@catalogRefreshProperties.zone}")
    public void runBySchedule() {
        if (!properties.isEnabled() || !properties.isScheduledEnabled()) {
            return;
        }
        runRefresh("scheduled");
    }

    boolean runRefresh(String trigger) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Catalog refresh skipped because previous refresh is still running (trigger={})", trigger);
            return false;
        }

        try {
            CatalogSnapshot snapshot = catalogRefreshService.refresh(trigger);
            log.debug("Catalog snapshot swapped (trigger={}, loadedAt={})", trigger, snapshot.loadedAt());
            return true;
        } catch (Exception exception) {
            log.warn("Catalog refresh failed (trigger={}): {}", trigger, exception.getMessage());
            return false;
        } finally {
            running.set(false);
        }
    }
}
