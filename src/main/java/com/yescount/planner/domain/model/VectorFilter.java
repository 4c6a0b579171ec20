package com.yescount.planner.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Metadata filter for similarity search: dateStart within [dateFrom, dateTo] and priceMax ceiling.
 */
public record VectorFilter(
        LocalDate dateFrom,
        LocalDate dateTo,
        BigDecimal priceMax
) {
    public static VectorFilter from(EventQuery query) {
        return new VectorFilter(query.dateFrom(), query.dateTo(), query.priceMax());
    }
}
