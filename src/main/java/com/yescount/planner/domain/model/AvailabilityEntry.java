package com.yescount.planner.domain.model;

/**
 * One participant marking one slot as available.
 */
public record AvailabilityEntry(
        long participantId,
        String date,
        String timeStart,
        String timeEnd
) {}
