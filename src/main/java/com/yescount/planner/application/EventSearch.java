package com.yescount.planner.application;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.EventQuery;
import com.yescount.planner.domain.model.VectorFilter;
import com.yescount.planner.domain.port.out.EmbeddingClient;
import com.yescount.planner.domain.port.out.EventRepository;
import com.yescount.planner.domain.port.out.VectorCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class EventSearch implements SearchEvents {

    private static final Logger logger = LoggerFactory.getLogger(EventSearch.class);

    static final int VECTOR_RESULTS = 20;

    private final EventRepository eventRepository;
    private final Optional<EmbeddingClient> embeddingClient;
    private final Optional<VectorCollection> vectorCollection;

    public EventSearch(EventRepository eventRepository,
                       Optional<EmbeddingClient> embeddingClient,
                       Optional<VectorCollection> vectorCollection) {
        this.eventRepository = eventRepository;
        this.embeddingClient = embeddingClient;
        this.vectorCollection = vectorCollection;
    }

    @Override
    public List<Event> execute(EventQuery query) {
        if (embeddingClient.isEmpty() || vectorCollection.isEmpty() || query.text().isBlank()) {
            return eventRepository.findByFilter(query);
        }

        try {
            List<Double> vector = embeddingClient.get().embed(query.text());
            List<Long> ids = vectorCollection.get().query(vector, VECTOR_RESULTS, VectorFilter.from(query));
            if (ids.isEmpty()) {
                return List.of();
            }
            List<Event> ordered = eventRepository.findByIds(ids);
            logger.debug("Semantic search for '{}' matched {} events", query.text(), ordered.size());
            return ordered.stream().filter(query::matchesTags).toList();

        } catch (RuntimeException e) {
            logger.warn("Semantic search failed, falling back to filtered read: {}", e.getMessage());
            return eventRepository.findByFilter(query);
        }
    }
}
