package com.yescount.planner.domain.model;

public record RecommendedEvent(
        Event event,
        double interestScore,
        double overlapScore,
        double adminScore,
        double compositeScore
) {}
