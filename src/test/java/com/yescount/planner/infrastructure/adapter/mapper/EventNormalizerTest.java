package com.yescount.planner.infrastructure.adapter.mapper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yescount.planner.domain.heuristics.DateHeuristics;
import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.EventSource;
import com.yescount.planner.infrastructure.adapter.provider.json.OpenDataEventJson;
import com.yescount.planner.infrastructure.adapter.scraper.ScrapedEventRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class EventNormalizerTest {

    private EventNormalizer eventNormalizer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);
        eventNormalizer = new EventNormalizer(new DateHeuristics(clock), new ObjectMapper());
    }

    @Test
    void shouldMapApiRowUsingFallbackColumns() {
        // Given
        OpenDataEventJson row = new OpenDataEventJson(" ", "Jazz in the park", null, "Free show",
                "2026-04-04T19:00:00.000", null, null, "Central Park", "$20", true,
                null, "https://nyc.gov/jazz", null, "row-abc");

        // When
        Event event = eventNormalizer.normalizeApiEvent(row);

        // Then
        assertThat(event.title()).isEqualTo("Jazz in the park");
        assertThat(event.description()).isEqualTo("Free show");
        assertThat(event.dateStart()).isEqualTo(OffsetDateTime.parse("2026-04-04T19:00:00Z"));
        assertThat(event.dateEnd()).isNull();
        assertThat(event.location()).isEqualTo("Central Park");
        assertThat(event.priceMin()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(event.priceMax()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(event.url()).isEqualTo("https://nyc.gov/jazz");
        assertThat(event.source()).isEqualTo(EventSource.API);
        assertThat(event.sourceId()).isEqualTo("row-abc");
        assertThat(event.tags()).containsExactly("outdoor");
        assertThat(event.rawPayload()).contains("\"short_description\":\"Free show\"");
    }

    @Test
    void shouldParsePriceColumnWhenNotFree() {
        OpenDataEventJson row = new OpenDataEventJson("Harbor cruise", null, null, null,
                null, null, null, null, "$15 - $30", false, null, null, "E-9", null);

        Event event = eventNormalizer.normalizeApiEvent(row);

        assertThat(event.priceMin()).isEqualByComparingTo("15");
        assertThat(event.priceMax()).isEqualByComparingTo("30");
        assertThat(event.sourceId()).isEqualTo("E-9");
        assertThat(event.dateStart()).isNull();
    }

    @Test
    void shouldFallBackToTitleAsSourceId() {
        OpenDataEventJson row = new OpenDataEventJson("Poetry slam", null, null, null,
                null, null, null, null, null, null, null, null, null, null);

        assertThat(eventNormalizer.normalizeApiEvent(row).sourceId()).isEqualTo("Poetry slam");
    }

    @Test
    void shouldUseUntitledForEmptyRow() {
        OpenDataEventJson row = new OpenDataEventJson(null, null, null, null,
                null, null, null, null, null, null, null, null, null, null);

        Event event = eventNormalizer.normalizeApiEvent(row);

        assertThat(event.title()).isEqualTo(Event.UNTITLED);
        assertThat(event.sourceId()).isEqualTo(Event.UNTITLED);
    }

    @Test
    void shouldMapScrapedRecord() {
        // Given
        ScrapedEventRecord record = new ScrapedEventRecord("Immersive Gatsby Party",
                "Dance through the roaring twenties at the art deco ballroom",
                "2026-05-02T00:00Z", null, "single", "", "$45",
                "https://tickets.example.com/gatsby", "https://secretnyc.co/img/gatsby.jpg",
                "secretnyc-0123456789ab");

        // When
        Event event = eventNormalizer.normalizeScraped(record);

        // Then
        assertThat(event.source()).isEqualTo(EventSource.SCRAPED);
        assertThat(event.sourceId()).isEqualTo("secretnyc-0123456789ab");
        assertThat(event.dateStart()).isEqualTo(OffsetDateTime.parse("2026-05-02T00:00:00Z"));
        assertThat(event.priceMin()).isEqualByComparingTo("45");
        assertThat(event.tags()).containsExactly("artsy", "immersive");
        assertThat(event.rawPayload()).contains("\"date_status\":\"single\"");
    }
}
