package com.yescount.planner.domain.port.out;

import com.yescount.planner.domain.model.Event;

import java.util.List;

/**
 * Port for the structured open-data API.
 * Domain doesn't care about HTTP, JSON, pagination, etc.
 */
public interface StructuredEventProvider {

    String sourceName();

    String sourceUrl();

    /**
     * @return false when the provider lacks the settings it needs to run
     */
    boolean isConfigured();

    /**
     * Fetch and normalize every event the API exposes.
     *
     * @throws SourceFetchException on transport failure
     */
    List<Event> fetchEvents();
}
