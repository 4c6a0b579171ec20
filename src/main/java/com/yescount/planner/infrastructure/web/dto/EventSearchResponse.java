package com.yescount.planner.infrastructure.web.dto;

import com.yescount.planner.domain.model.Event;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

public record EventSearchResponse(
        EventData data
) {
    public static EventSearchResponse fromEvents(List<Event> events) {
        var eventDtos = events.stream()
                .map(EventDto::fromEvent)
                .toList();

        return new EventSearchResponse(new EventData(eventDtos));
    }

    public static EventSearchResponse empty() {
        return new EventSearchResponse(new EventData(List.of()));
    }

    public record EventData(
            List<EventDto> events
    ) {}

    public record EventDto(
            Long id,
            String title,
            String description,
            OffsetDateTime date_start,
            OffsetDateTime date_end,
            String location,
            BigDecimal price_min,
            BigDecimal price_max,
            String url,
            String source,
            List<String> tags
    ) {
        public static EventDto fromEvent(Event event) {
            return new EventDto(
                    event.id(),
                    event.title(),
                    event.description(),
                    event.dateStart(),
                    event.dateEnd(),
                    event.location(),
                    event.priceMin(),
                    event.priceMax(),
                    event.url(),
                    event.source().code(),
                    event.tags()
            );
        }
    }
}
