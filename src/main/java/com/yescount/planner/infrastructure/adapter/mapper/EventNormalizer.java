package com.yescount.planner.infrastructure.adapter.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yescount.planner.domain.heuristics.DateHeuristics;
import com.yescount.planner.domain.heuristics.PriceHeuristics;
import com.yescount.planner.domain.heuristics.PriceRange;
import com.yescount.planner.domain.heuristics.TagExtractor;
import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.EventSource;
import com.yescount.planner.infrastructure.adapter.provider.json.OpenDataEventJson;
import com.yescount.planner.infrastructure.adapter.scraper.ScrapedEventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw source records into the canonical {@link Event}.
 */
@Component
public class EventNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(EventNormalizer.class);

    private final DateHeuristics dateHeuristics;
    private final ObjectMapper objectMapper;

    public EventNormalizer(DateHeuristics dateHeuristics, ObjectMapper objectMapper) {
        this.dateHeuristics = dateHeuristics;
        this.objectMapper = objectMapper;
    }

    /**
     * Maps one open-data row. The free flag wins over the price column.
     */
    public Event normalizeApiEvent(OpenDataEventJson raw) {
        String title = firstNonBlank(raw.eventName(), raw.title());
        String description = firstNonBlank(raw.description(), raw.shortDescription());
        PriceRange price = Boolean.TRUE.equals(raw.free()) ? PriceRange.FREE : PriceHeuristics.parse(raw.price());

        return new Event(
                null,
                title,
                description,
                dateHeuristics.parseIso(raw.startDateTime()),
                dateHeuristics.parseIso(raw.endDateTime()),
                firstNonBlank(raw.location(), raw.eventLocation()),
                price.min(),
                price.max(),
                firstNonBlank(raw.eventUrl(), raw.url()),
                EventSource.API,
                sourceIdOf(firstNonBlank(raw.eventId(), raw.rowId()), title),
                toJson(raw),
                TagExtractor.extract(title + " " + description));
    }

    /**
     * Maps one scraped record. Dates were already classified by the extractor.
     */
    public Event normalizeScraped(ScrapedEventRecord raw) {
        String title = firstNonBlank(raw.title());
        String description = firstNonBlank(raw.description());
        PriceRange price = PriceHeuristics.parse(raw.priceText());

        return new Event(
                null,
                title,
                description,
                dateHeuristics.parseIso(raw.dateStart()),
                dateHeuristics.parseIso(raw.dateEnd()),
                firstNonBlank(raw.location()),
                price.min(),
                price.max(),
                firstNonBlank(raw.url()),
                EventSource.SCRAPED,
                sourceIdOf(raw.sourceId(), title),
                toJson(raw),
                TagExtractor.extract(title + " " + description));
    }

    // ===== Private Helper Methods =====

    private String toJson(Object raw) {
        try {
            return objectMapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize raw payload of type {}: {}", raw.getClass().getSimpleName(),
                    e.getMessage());
            return "{}";
        }
    }

    private static String sourceIdOf(String candidate, String title) {
        if (candidate != null && !candidate.isBlank()) {
            return candidate.strip();
        }
        return title.isBlank() ? Event.UNTITLED : title;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.strip();
            }
        }
        return "";
    }
}
