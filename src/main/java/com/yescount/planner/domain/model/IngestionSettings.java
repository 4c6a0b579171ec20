package com.yescount.planner.domain.model;

import java.time.Duration;

/**
 * Run-level policy knobs for the ingestion pipeline.
 *
 * @param maxStaleness          a completed run younger than this makes a non-forced run skip
 * @param requiredSourcesStrict a failed required source fails the run instead of degrading it
 * @param lockTtl               how long the cross-process run lock is held at most
 */
public record IngestionSettings(
        Duration maxStaleness,
        boolean requiredSourcesStrict,
        Duration lockTtl
) {
    public static final IngestionSettings DEFAULT =
            new IngestionSettings(Duration.ofHours(192), true, Duration.ofMinutes(60));
}
