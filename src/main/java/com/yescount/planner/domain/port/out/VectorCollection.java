package com.yescount.planner.domain.port.out;

import com.yescount.planner.domain.model.VectorFilter;
import com.yescount.planner.domain.model.VectorMetadata;

import java.util.List;

/**
 * Similarity-search store keyed by {@code event_<id>}.
 */
public interface VectorCollection {

    String ID_PREFIX = "event_";

    void upsert(String id, String document, List<Double> embedding, VectorMetadata metadata);

    /**
     * @return matching event ids, most similar first
     */
    List<Long> query(List<Double> embedding, int limit, VectorFilter filter);

    static String idFor(long eventId) {
        return ID_PREFIX + eventId;
    }
}
