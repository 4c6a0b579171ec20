package com.yescount.planner.domain.heuristics;

import java.util.Locale;

/**
 * How confidently a date was read from free text.
 */
public enum DateStatus {
    /** Exactly one distinct calendar date. */
    SINGLE,
    /** One explicit "Month D-D" range. */
    RANGE,
    /** Several distinct dates that do not form a clean range. */
    MULTIPLE,
    /** Nothing recognisable, or a phrase that failed to parse. */
    UNCLEAR;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
