package com.yescount.planner.domain.heuristics;

import java.math.BigDecimal;

/**
 * Parsed price bounds. Both null when no price could be read.
 */
public record PriceRange(BigDecimal min, BigDecimal max) {

    public static final PriceRange FREE = new PriceRange(BigDecimal.ZERO, BigDecimal.ZERO);
    public static final PriceRange UNKNOWN = new PriceRange(null, null);
}
