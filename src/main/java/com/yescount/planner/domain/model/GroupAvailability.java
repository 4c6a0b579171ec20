package com.yescount.planner.domain.model;

import java.util.List;

public record GroupAvailability(
        int participantCount,
        List<AvailabilitySlot> slots
) {}
