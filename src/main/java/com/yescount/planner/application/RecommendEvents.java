package com.yescount.planner.application;

import com.yescount.planner.domain.model.AdminPreferences;
import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.RecommendedEvent;
import com.yescount.planner.domain.model.ScoringWeights;
import com.yescount.planner.domain.port.out.EventRepository;
import com.yescount.planner.domain.recommendation.RecommendationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class RecommendEvents {

    private static final Logger logger = LoggerFactory.getLogger(RecommendEvents.class);

    private final EventRepository eventRepository;
    private final RecommendationEngine recommendationEngine;

    public RecommendEvents(EventRepository eventRepository, RecommendationEngine recommendationEngine) {
        this.eventRepository = eventRepository;
        this.recommendationEngine = recommendationEngine;
    }

    /**
     * Ranks the candidate events. An empty candidate list means every event that received a vote.
     */
    public List<RecommendedEvent> execute(List<Long> candidateIds, Map<Long, Integer> voteTallies,
                                          Map<Long, Double> overlapByEventId, AdminPreferences prefs,
                                          ScoringWeights weights, int topN) {
        List<Long> ids = candidateIds.isEmpty() ? List.copyOf(voteTallies.keySet()) : candidateIds;
        List<Event> events = ids.isEmpty() ? List.of() : eventRepository.findByIds(ids);
        logger.debug("Ranking {} candidate events", events.size());
        return recommendationEngine.recommend(events, voteTallies, overlapByEventId, prefs, weights, topN);
    }
}
