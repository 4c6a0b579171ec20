package com.yescount.planner.infrastructure.web.dto;

import com.yescount.planner.domain.model.IngestionOutcome;

import java.util.List;
import java.util.Locale;

public record IngestionRunResponse(
        String status,
        int events_upserted,
        String reason,
        List<String> required_failed,
        List<String> errors
) {
    public static IngestionRunResponse fromOutcome(IngestionOutcome outcome) {
        return new IngestionRunResponse(
                outcome.status().name().toLowerCase(Locale.ROOT),
                outcome.eventsUpserted(),
                outcome.reason(),
                outcome.requiredFailed(),
                outcome.errors()
        );
    }
}
