package com.yescount.planner.domain.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public record VectorMetadata(
        OffsetDateTime dateStart,
        BigDecimal priceMax,
        EventSource source
) {
    public static VectorMetadata of(Event event) {
        return new VectorMetadata(event.dateStart(), event.priceMax(), event.source());
    }
}
