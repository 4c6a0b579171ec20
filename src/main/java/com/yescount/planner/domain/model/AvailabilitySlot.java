package com.yescount.planner.domain.model;

import java.util.List;

public record AvailabilitySlot(
        String date,
        String timeStart,
        String timeEnd,
        List<Long> participantIds,
        double overlapScore
) {}
