package com.yescount.planner.infrastructure.adapter.provider;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.port.out.SourceFetchException;
import com.yescount.planner.domain.port.out.StructuredEventProvider;
import com.yescount.planner.infrastructure.adapter.mapper.EventNormalizer;
import com.yescount.planner.infrastructure.adapter.provider.json.OpenDataEventJson;
import com.yescount.planner.infrastructure.config.OpenDataProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import retrofit2.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Component
public class OpenDataClient implements StructuredEventProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenDataClient.class);

    static final String SOURCE_NAME = "nyc_open_data";
    static final String SOURCE_URL = "https://data.cityofnewyork.us/";

    private final OpenDataApi openDataApi;
    private final EventNormalizer eventNormalizer;
    private final OpenDataProperties properties;

    public OpenDataClient(OpenDataApi openDataApi, EventNormalizer eventNormalizer, OpenDataProperties properties) {
        this.openDataApi = openDataApi;
        this.eventNormalizer = eventNormalizer;
        this.properties = properties;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public String sourceUrl() {
        return SOURCE_URL;
    }

    @Override
    public boolean isConfigured() {
        return properties.hasDataset();
    }

    @Override
    public List<Event> fetchEvents() {
        List<OpenDataEventJson> rows = fetchAllRows();
        logger.info("Fetched {} rows from dataset {}", rows.size(), properties.getDatasetId());
        return rows.stream()
                .map(eventNormalizer::normalizeApiEvent)
                .toList();
    }

    /**
     * Follows pages until the API returns an empty one. No overall cap and no retries.
     */
    List<OpenDataEventJson> fetchAllRows() {
        List<OpenDataEventJson> rows = new ArrayList<>();
        int pageSize = properties.getPageSize();
        int offset = 0;
        while (true) {
            List<OpenDataEventJson> page = fetchPage(offset, pageSize);
            if (page.isEmpty()) {
                return rows;
            }
            rows.addAll(page);
            offset += pageSize;
        }
    }

    private List<OpenDataEventJson> fetchPage(int offset, int limit) {
        String token = properties.getAppToken() == null || properties.getAppToken().isBlank()
                ? null
                : properties.getAppToken();
        Response<List<OpenDataEventJson>> response;
        try {
            logger.debug("Fetching open-data page offset={} limit={}", offset, limit);
            response = openDataApi.fetchPage(properties.getDatasetId(), token, limit, offset).execute();
        } catch (IOException e) {
            logger.error("Transport error fetching open-data page at offset {}: {}", offset, e.getMessage());
            throw new SourceFetchException("Failed to fetch open-data page at offset " + offset, e);
        }

        if (!response.isSuccessful()) {
            logger.error("Open-data API answered HTTP {} at offset {}", response.code(), offset);
            throw new SourceFetchException("Open-data API returned HTTP " + response.code());
        }
        List<OpenDataEventJson> body = response.body();
        return body != null ? body : List.of();
    }
}
