package com.yescount.planner.domain.model;

/**
 * Outcome of one source within an ingestion run.
 */
public record SourceCheck(
        long runId,
        String sourceName,
        String sourceUrl,
        boolean required,
        SourceCheckStatus status,
        int eventsFound,
        String error
) {
    public static final int MAX_ERROR_LENGTH = 1000;

    public SourceCheck {
        eventsFound = Math.max(eventsFound, 0);
        error = truncate(error == null ? "" : error, MAX_ERROR_LENGTH);
    }

    public static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
