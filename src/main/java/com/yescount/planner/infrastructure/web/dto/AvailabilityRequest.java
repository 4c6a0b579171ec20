package com.yescount.planner.infrastructure.web.dto;

import com.yescount.planner.domain.model.AvailabilityEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record AvailabilityRequest(
        @PositiveOrZero int participant_count,
        @NotNull List<@Valid EntryDto> entries
) {
    public List<AvailabilityEntry> toEntries() {
        return entries.stream()
                .map(EntryDto::toDomain)
                .toList();
    }

    public record EntryDto(
            long participant_id,
            @NotBlank String date,
            @NotBlank String time_start,
            @NotBlank String time_end
    ) {
        AvailabilityEntry toDomain() {
            return new AvailabilityEntry(participant_id, date, time_start, time_end);
        }
    }
}
