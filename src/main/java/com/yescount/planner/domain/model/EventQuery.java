package com.yescount.planner.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Filtered read against the event store. Every field is optional.
 */
public record EventQuery(
        String text,
        LocalDate dateFrom,
        LocalDate dateTo,
        BigDecimal priceMax,
        List<String> tags
) {
    public static final int MAX_RESULTS = 500;

    public EventQuery {
        text = text == null ? "" : text.strip();
        tags = tags == null ? List.of() : tags.stream().map(tag -> tag.toLowerCase(Locale.ROOT)).toList();
    }

    public static EventQuery all() {
        return new EventQuery("", null, null, null, List.of());
    }

    public boolean matchesTags(Event event) {
        return tags.isEmpty() || event.tags().stream()
                .map(tag -> tag.toLowerCase(Locale.ROOT))
                .anyMatch(tags::contains);
    }
}
