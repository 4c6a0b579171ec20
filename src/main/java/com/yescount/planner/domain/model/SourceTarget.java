package com.yescount.planner.domain.model;

/**
 * A configured scraped site.
 */
public record SourceTarget(
        String name,
        String url,
        boolean required,
        boolean enabled
) {
    public SourceTarget {
        name = name == null ? "" : name.strip();
        url = url == null ? "" : url.strip();
    }

    public boolean isUsable() {
        return !name.isEmpty() && !url.isEmpty();
    }
}
