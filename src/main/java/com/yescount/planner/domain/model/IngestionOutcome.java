package com.yescount.planner.domain.model;

import java.util.List;

/**
 * What a caller learns from one orchestrator invocation.
 */
public record IngestionOutcome(
        OutcomeStatus status,
        int eventsUpserted,
        String reason,
        List<String> requiredFailed,
        List<String> errors
) {
    public IngestionOutcome {
        reason = reason == null ? "" : reason;
        requiredFailed = requiredFailed == null ? List.of() : List.copyOf(requiredFailed);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static IngestionOutcome skipped(String reason) {
        return new IngestionOutcome(OutcomeStatus.SKIPPED, 0, reason, List.of(), List.of());
    }

    public static IngestionOutcome success(int eventsUpserted) {
        return new IngestionOutcome(OutcomeStatus.SUCCESS, eventsUpserted, "", List.of(), List.of());
    }

    public static IngestionOutcome requiredSourcesFailed(RunStatus status, int eventsUpserted, List<String> failed) {
        return new IngestionOutcome(OutcomeStatus.of(status), eventsUpserted, "", failed, List.of());
    }

    public static IngestionOutcome failed(int eventsUpserted, List<String> errors) {
        return new IngestionOutcome(OutcomeStatus.FAILED, eventsUpserted, "", List.of(), errors);
    }
}
