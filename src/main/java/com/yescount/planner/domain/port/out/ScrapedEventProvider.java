package com.yescount.planner.domain.port.out;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.SourceTarget;

import java.util.List;

/**
 * Port for scraped web pages.
 */
public interface ScrapedEventProvider {

    /**
     * Fetch one configured site and normalize what it lists.
     *
     * @throws SourceFetchException on transport failure
     */
    List<Event> scrape(SourceTarget target);
}
