package com.yescount.planner.domain.model;

public enum OutcomeStatus {
    SKIPPED,
    SUCCESS,
    DEGRADED,
    FAILED;

    public static OutcomeStatus of(RunStatus status) {
        return switch (status) {
            case SUCCESS -> SUCCESS;
            case DEGRADED -> DEGRADED;
            case FAILED, RUNNING -> FAILED;
        };
    }
}
