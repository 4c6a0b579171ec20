package com.yescount.planner.domain.model;

import java.time.OffsetDateTime;

public record IngestionRun(
        long id,
        OffsetDateTime startedAt,
        OffsetDateTime finishedAt,
        RunStatus status,
        int totalEventsUpserted,
        String errorSummary
) {}
