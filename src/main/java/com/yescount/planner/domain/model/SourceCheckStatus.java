package com.yescount.planner.domain.model;

import java.util.Locale;

public enum SourceCheckStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    SKIPPED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceCheckStatus fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
