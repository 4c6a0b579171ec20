package com.yescount.planner.infrastructure.adapter.provider.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the open-data events dataset. Datasets differ in which of the alternative
 * columns they fill, so every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OpenDataEventJson(
        @JsonProperty("event_name") String eventName,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("short_description") String shortDescription,
        @JsonProperty("start_date_time") String startDateTime,
        @JsonProperty("end_date_time") String endDateTime,
        @JsonProperty("location") String location,
        @JsonProperty("event_location") String eventLocation,
        @JsonProperty("price") String price,
        @JsonProperty("free") Boolean free,
        @JsonProperty("event_url") String eventUrl,
        @JsonProperty("url") String url,
        @JsonProperty("event_id") String eventId,
        @JsonProperty(":id") String rowId
) {}
