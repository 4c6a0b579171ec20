package com.yescount.planner.domain.heuristics;

import java.time.OffsetDateTime;

public record DateExtraction(
        DateStatus status,
        OffsetDateTime start,
        OffsetDateTime end
) {
    public static DateExtraction unclear() {
        return new DateExtraction(DateStatus.UNCLEAR, null, null);
    }

    public static DateExtraction multiple() {
        return new DateExtraction(DateStatus.MULTIPLE, null, null);
    }

    public static DateExtraction single(OffsetDateTime start) {
        return new DateExtraction(DateStatus.SINGLE, start, null);
    }

    public static DateExtraction range(OffsetDateTime start, OffsetDateTime end) {
        return new DateExtraction(DateStatus.RANGE, start, end);
    }
}
