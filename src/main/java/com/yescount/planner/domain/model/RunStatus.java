package com.yescount.planner.domain.model;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    DEGRADED,
    FAILED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
