package com.yescount.planner.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * NYC Open Data (Socrata) connection settings. A blank dataset id disables the source.
 */
@Component
@ConfigurationProperties(prefix = "yescount.open-data")
public class OpenDataProperties {

    private String baseUrl = "https://data.cityofnewyork.us/";
    private String datasetId = "";
    private String appToken = "";
    private int pageSize = 200;
    private int timeoutSeconds = 30;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public void setDatasetId(String datasetId) {
        this.datasetId = datasetId;
    }

    public String getAppToken() {
        return appToken;
    }

    public void setAppToken(String appToken) {
        this.appToken = appToken;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public boolean hasDataset() {
        return datasetId != null && !datasetId.isBlank();
    }
}
