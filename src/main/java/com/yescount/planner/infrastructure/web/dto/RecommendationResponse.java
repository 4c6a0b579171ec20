package com.yescount.planner.infrastructure.web.dto;

import com.yescount.planner.domain.model.RecommendedEvent;

import java.util.List;

public record RecommendationResponse(
        List<RecommendationDto> recommendations
) {
    public static RecommendationResponse fromRecommendations(List<RecommendedEvent> ranked) {
        return new RecommendationResponse(ranked.stream()
                .map(RecommendationDto::fromRecommended)
                .toList());
    }

    public static RecommendationResponse empty() {
        return new RecommendationResponse(List.of());
    }

    public record RecommendationDto(
            EventSearchResponse.EventDto event,
            double interest_score,
            double overlap_score,
            double admin_score,
            double composite_score
    ) {
        public static RecommendationDto fromRecommended(RecommendedEvent recommended) {
            return new RecommendationDto(
                    EventSearchResponse.EventDto.fromEvent(recommended.event()),
                    recommended.interestScore(),
                    recommended.overlapScore(),
                    recommended.adminScore(),
                    recommended.compositeScore()
            );
        }
    }
}
