package com.yescount.planner.domain.port.out;

import java.util.List;

/**
 * Text-to-vector capability. No implementation ships with this project;
 * when no bean is present, ingestion skips embeddings and search falls back to the store.
 */
public interface EmbeddingClient {

    List<Double> embed(String text);

    /**
     * @return one vector per input text, in input order
     */
    List<List<Double>> embedBatch(List<String> texts);
}
