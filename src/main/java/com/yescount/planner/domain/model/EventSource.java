package com.yescount.planner.domain.model;

import java.util.Arrays;

/**
 * Kind of source an event was ingested from.
 * The lower-case code is what gets persisted.
 */
public enum EventSource {

    API("api"),
    SCRAPED("scraped");

    private final String code;

    EventSource(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static EventSource fromCode(String code) {
        return Arrays.stream(values())
                .filter(source -> source.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event source: " + code));
    }
}
