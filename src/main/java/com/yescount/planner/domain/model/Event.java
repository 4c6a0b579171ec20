package com.yescount.planner.domain.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Canonical event shape shared by every source.
 * Identity is the (source, sourceId) pair; id is assigned by the store.
 */
public record Event(
        Long id,
        String title,
        String description,
        OffsetDateTime dateStart,
        OffsetDateTime dateEnd,
        String location,
        BigDecimal priceMin,
        BigDecimal priceMax,
        String url,
        EventSource source,
        String sourceId,
        String rawPayload,
        List<String> tags
) {
    public static final String UNTITLED = "Untitled Event";

    public Event {
        Objects.requireNonNull(source, "source");
        title = title == null || title.isBlank() ? UNTITLED : title.strip();
        description = description == null ? "" : description.strip();
        location = location == null ? "" : location.strip();
        url = url == null ? "" : url.strip();
        if (priceMin != null && priceMax != null && priceMin.compareTo(priceMax) > 0) {
            throw new IllegalArgumentException(
                    "priceMin " + priceMin + " exceeds priceMax " + priceMax + " for " + title);
        }
        tags = tags == null ? List.of() : List.copyOf(new TreeSet<>(tags));
    }

    public Event withId(Long newId) {
        return new Event(newId, title, description, dateStart, dateEnd, location,
                priceMin, priceMax, url, source, sourceId, rawPayload, tags);
    }

    /**
     * ISO-8601 rendering of dateStart, empty when absent. Used as a sort key.
     */
    public String dateStartIso() {
        return dateStart == null ? "" : dateStart.toString();
    }

    /**
     * YYYY-MM-DD prefix of dateStart, empty when absent.
     */
    public String dateStartDay() {
        return dateStart == null ? "" : dateStart.toLocalDate().toString();
    }
}
