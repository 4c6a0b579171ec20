package com.yescount.planner.domain.port.out;

import com.yescount.planner.domain.model.SourceTarget;

import java.util.List;

public interface SourceCatalog {

    /**
     * Configured scraped sites, with blank names or urls already discarded.
     */
    List<SourceTarget> loadSources();
}
