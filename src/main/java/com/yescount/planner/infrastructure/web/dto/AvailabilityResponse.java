package com.yescount.planner.infrastructure.web.dto;

import com.yescount.planner.domain.model.AvailabilitySlot;
import com.yescount.planner.domain.model.GroupAvailability;

import java.util.List;

public record AvailabilityResponse(
        int participant_count,
        List<SlotDto> slots
) {
    public static AvailabilityResponse fromGroup(GroupAvailability group) {
        return new AvailabilityResponse(
                group.participantCount(),
                group.slots().stream().map(SlotDto::fromSlot).toList());
    }

    public record SlotDto(
            String date,
            String time_start,
            String time_end,
            List<Long> participant_ids,
            double overlap_score
    ) {
        public static SlotDto fromSlot(AvailabilitySlot slot) {
            return new SlotDto(slot.date(), slot.timeStart(), slot.timeEnd(), slot.participantIds(),
                    slot.overlapScore());
        }
    }
}
