package com.yescount.planner.infrastructure.adapter.scraper;

import com.yescount.planner.domain.port.out.SourceFetchException;
import com.yescount.planner.infrastructure.config.ScraperProperties;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class JsoupPageFetcher implements PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final ScraperProperties properties;

    public JsoupPageFetcher(ScraperProperties properties) {
        this.properties = properties;
    }

    @Override
    public Document fetch(String url) {
        try {
            logger.debug("Fetching page {}", url);
            return Jsoup.connect(url)
                    .userAgent(properties.getUserAgent())
                    .timeout(properties.getTimeoutSeconds() * 1000)
                    .get();
        } catch (HttpStatusException e) {
            logger.error("HTTP {} fetching {}", e.getStatusCode(), url);
            throw new SourceFetchException("HTTP " + e.getStatusCode() + " fetching " + url, e);
        } catch (IOException e) {
            logger.error("Error fetching URL {}: {}", url, e.getMessage());
            throw new SourceFetchException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }
    }
}
