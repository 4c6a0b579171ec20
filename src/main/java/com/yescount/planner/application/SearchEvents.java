package com.yescount.planner.application;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.EventQuery;

import java.util.List;

/**
 * Finding stored events for a free-text and filter query.
 */
public interface SearchEvents {

    /**
     * Executes the query. A non-blank text is matched semantically when a vector index is
     * available, otherwise by substring against title, description and location.
     *
     * @param query text, date window, price ceiling and tag filters, all optional
     * @return matching events, best match first for semantic results, by date otherwise
     */
    List<Event> execute(EventQuery query);
}
