package com.yescount.planner.infrastructure.adapter.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What an extractor read off a page for one event, before normalization.
 * Dates are ISO-8601 strings or null; {@code dateStatus} records how the date text was classified.
 */
public record ScrapedEventRecord(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("date_start") String dateStart,
        @JsonProperty("date_end") String dateEnd,
        @JsonProperty("date_status") String dateStatus,
        @JsonProperty("location") String location,
        @JsonProperty("price") String priceText,
        @JsonProperty("url") String url,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("source_id") String sourceId
) {}
