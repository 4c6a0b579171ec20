package com.yescount.planner.infrastructure.adapter.scraper;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the extractor for a source name; unregistered names get the card extractor.
 */
@Component
public class SiteExtractorRegistry {

    private final Map<String, SiteExtractor> byName = new HashMap<>();
    private final SiteExtractor fallback;

    public SiteExtractorRegistry(List<SiteExtractor> extractors, CardSiteExtractor fallback) {
        this.fallback = fallback;
        for (SiteExtractor extractor : extractors) {
            extractor.sourceNames().forEach(name -> byName.put(name, extractor));
        }
    }

    public SiteExtractor forSource(String sourceName) {
        return byName.getOrDefault(sourceName, fallback);
    }
}
