package com.yescount.planner.domain.port.out;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.EventQuery;

import java.util.List;

/**
 * Repository port for the Event aggregate
 * This is the contract that infrastructure must implement
 */
public interface EventRepository {

    /**
     * Insert or refresh an event keyed by (source, sourceId).
     * Re-upserting the same key overwrites the stored fields and keeps the id.
     *
     * @return the stable id of the stored event
     */
    long upsert(Event event);

    /**
     * Every stored event, ordered by id.
     */
    List<Event> findAll();

    /**
     * Filtered read, ordered by date_start and capped at {@link EventQuery#MAX_RESULTS}.
     */
    List<Event> findByFilter(EventQuery query);

    /**
     * Events for the given ids, in the order of the ids. Unknown ids are skipped.
     */
    List<Event> findByIds(List<Long> ids);
}
