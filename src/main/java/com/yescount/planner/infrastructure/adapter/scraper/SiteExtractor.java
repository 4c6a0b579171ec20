package com.yescount.planner.infrastructure.adapter.scraper;

import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Set;

/**
 * Strategy for turning one fetched page into event records.
 */
public interface SiteExtractor {

    /**
     * Source names this extractor is registered for. Empty for the generic extractor.
     */
    Set<String> sourceNames();

    List<ScrapedEventRecord> extract(Document page, String pageUrl, String sourceLabel);
}
