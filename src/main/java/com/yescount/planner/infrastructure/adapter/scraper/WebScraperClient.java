package com.yescount.planner.infrastructure.adapter.scraper;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.SourceTarget;
import com.yescount.planner.domain.port.out.ScrapedEventProvider;
import com.yescount.planner.infrastructure.adapter.mapper.EventNormalizer;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class WebScraperClient implements ScrapedEventProvider {

    private static final Logger logger = LoggerFactory.getLogger(WebScraperClient.class);

    private final PageFetcher pageFetcher;
    private final SiteExtractorRegistry extractorRegistry;
    private final EventNormalizer eventNormalizer;

    public WebScraperClient(PageFetcher pageFetcher, SiteExtractorRegistry extractorRegistry,
                            EventNormalizer eventNormalizer) {
        this.pageFetcher = pageFetcher;
        this.extractorRegistry = extractorRegistry;
        this.eventNormalizer = eventNormalizer;
    }

    @Override
    public List<Event> scrape(SourceTarget target) {
        Document page = pageFetcher.fetch(target.url());
        SiteExtractor extractor = extractorRegistry.forSource(target.name());
        List<ScrapedEventRecord> records = extractor.extract(page, target.url(), target.name());
        logger.info("Scraped {} candidate events from {} using {}", records.size(), target.name(),
                extractor.getClass().getSimpleName());
        return records.stream()
                .map(eventNormalizer::normalizeScraped)
                .toList();
    }
}
