package com.yescount.planner.infrastructure.config;

import com.yescount.planner.domain.model.IngestionSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Ingestion pipeline settings: staleness gate, required-source policy, source list location
 * and the scheduled refresh.
 */
@Component
@ConfigurationProperties(prefix = "yescount.ingestion")
public class IngestionProperties {

    private int maxStalenessHours = 192;
    private boolean requiredSourcesStrict = true;
    private String sitesConfigPath = "config/scraper_sites.yaml";
    private boolean autoRefresh = true;
    private String cron = "0 0 6 * * *";
    private int lockTtlMinutes = 60;

    public int getMaxStalenessHours() {
        return maxStalenessHours;
    }

    public void setMaxStalenessHours(int maxStalenessHours) {
        this.maxStalenessHours = maxStalenessHours;
    }

    public boolean isRequiredSourcesStrict() {
        return requiredSourcesStrict;
    }

    public void setRequiredSourcesStrict(boolean requiredSourcesStrict) {
        this.requiredSourcesStrict = requiredSourcesStrict;
    }

    public String getSitesConfigPath() {
        return sitesConfigPath;
    }

    public void setSitesConfigPath(String sitesConfigPath) {
        this.sitesConfigPath = sitesConfigPath;
    }

    public boolean isAutoRefresh() {
        return autoRefresh;
    }

    public void setAutoRefresh(boolean autoRefresh) {
        this.autoRefresh = autoRefresh;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public int getLockTtlMinutes() {
        return lockTtlMinutes;
    }

    public void setLockTtlMinutes(int lockTtlMinutes) {
        this.lockTtlMinutes = lockTtlMinutes;
    }

    public IngestionSettings toSettings() {
        return new IngestionSettings(
                Duration.ofHours(maxStalenessHours),
                requiredSourcesStrict,
                Duration.ofMinutes(lockTtlMinutes));
    }
}
