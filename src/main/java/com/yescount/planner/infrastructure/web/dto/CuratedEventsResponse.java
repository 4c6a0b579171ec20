package com.yescount.planner.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yescount.planner.application.CurateVotingList.CuratedList;
import com.yescount.planner.domain.model.VotingWindow;

import java.time.OffsetDateTime;

public record CuratedEventsResponse(
        WindowDto window,
        EventSearchResponse.EventData data
) {
    public static CuratedEventsResponse from(CuratedList curated) {
        return new CuratedEventsResponse(
                WindowDto.fromWindow(curated.window()),
                EventSearchResponse.fromEvents(curated.events()).data());
    }

    public static CuratedEventsResponse empty() {
        return new CuratedEventsResponse(null, EventSearchResponse.empty().data());
    }

    public record WindowDto(
            int target_year,
            int target_month,
            OffsetDateTime open_utc,
            OffsetDateTime close_utc,
            String deadline_label,
            @JsonProperty("is_open") boolean is_open
    ) {
        public static WindowDto fromWindow(VotingWindow window) {
            return new WindowDto(
                    window.targetYear(),
                    window.targetMonth(),
                    window.openUtc(),
                    window.closeUtc(),
                    window.deadlineLabel(),
                    window.open()
            );
        }
    }
}
