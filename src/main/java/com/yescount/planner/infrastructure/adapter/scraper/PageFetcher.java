package com.yescount.planner.infrastructure.adapter.scraper;

import com.yescount.planner.domain.port.out.SourceFetchException;
import org.jsoup.nodes.Document;

public interface PageFetcher {

    /**
     * Single GET of an HTML page, no script execution.
     *
     * @throws SourceFetchException on timeout, connection failure or non-2xx status
     */
    Document fetch(String url);
}
