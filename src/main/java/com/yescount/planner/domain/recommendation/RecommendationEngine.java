package com.yescount.planner.domain.recommendation;

import com.yescount.planner.domain.model.AdminPreferences;
import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.RecommendedEvent;
import com.yescount.planner.domain.model.ScoringWeights;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Post-vote ranking: group interest, schedule overlap and planner preference blended into one score.
 */
@Component
public class RecommendationEngine {

    public static final int DEFAULT_TOP_N = 5;

    private static final Comparator<RecommendedEvent> RANKING = Comparator
            .comparingDouble((RecommendedEvent r) -> -r.compositeScore())
            .thenComparingDouble(r -> -r.overlapScore())
            .thenComparing(r -> r.event().priceMin() == null ? BigDecimal.ZERO : r.event().priceMin())
            .thenComparing(r -> r.event().dateStartIso());

    public List<RecommendedEvent> recommend(List<Event> events, Map<Long, Integer> voteTallies,
                                            Map<Long, Double> overlapByEventId, AdminPreferences prefs) {
        return recommend(events, voteTallies, overlapByEventId, prefs, ScoringWeights.DEFAULT, DEFAULT_TOP_N);
    }

    public List<RecommendedEvent> recommend(List<Event> events, Map<Long, Integer> voteTallies,
                                            Map<Long, Double> overlapByEventId, AdminPreferences prefs,
                                            ScoringWeights weights, int topN) {
        int maxVotes = Math.max(voteTallies.values().stream()
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .max()
                .orElse(1), 1);

        return events.stream()
                .filter(event -> AdminRules.passesHardFilters(event, prefs))
                .map(event -> score(event, voteTallies, overlapByEventId, prefs, weights, maxVotes))
                .sorted(RANKING)
                .limit(Math.max(topN, 0))
                .toList();
    }

    private RecommendedEvent score(Event event, Map<Long, Integer> voteTallies, Map<Long, Double> overlapByEventId,
                                   AdminPreferences prefs, ScoringWeights weights, int maxVotes) {
        double interest = (double) valueOrZero(voteTallies, event.id()).intValue() / maxVotes;
        double overlap = valueOrZero(overlapByEventId, event.id()).doubleValue();
        double admin = AdminRules.adminScore(event, prefs);
        double composite = weights.interest() * interest + weights.overlap() * overlap + weights.admin() * admin;
        return new RecommendedEvent(event, interest, overlap, admin, composite);
    }

    // missing ids, unsaved events and null entries all count as zero
    private static Number valueOrZero(Map<Long, ? extends Number> values, Long eventId) {
        Number value = eventId == null ? null : values.get(eventId);
        return value == null ? 0 : value;
    }
}
