package com.yescount.planner.infrastructure.web.dto;

import com.yescount.planner.domain.model.AdminPreferences;
import com.yescount.planner.domain.model.ScoringWeights;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Votes and overlaps are keyed by event id. Omitted candidates mean every voted event.
 */
public record RecommendationRequest(
        List<Long> event_ids,
        Map<Long, @PositiveOrZero Integer> vote_tallies,
        Map<Long, @DecimalMin("0.0") Double> overlap_by_event_id,
        @Valid PreferencesDto preferences,
        @Valid WeightsDto weights,
        @Min(1) @Max(100) Integer top_n
) {
    public List<Long> eventIds() {
        return event_ids == null ? List.of() : event_ids;
    }

    public Map<Long, Integer> voteTallies() {
        return withoutNulls(vote_tallies);
    }

    public Map<Long, Double> overlapByEventId() {
        return withoutNulls(overlap_by_event_id);
    }

    private static <V> Map<Long, V> withoutNulls(Map<Long, V> values) {
        if (values == null) {
            return Map.of();
        }
        Map<Long, V> cleaned = new LinkedHashMap<>();
        values.forEach((eventId, value) -> {
            if (eventId != null && value != null) {
                cleaned.put(eventId, value);
            }
        });
        return cleaned;
    }

    public AdminPreferences toPreferences() {
        return preferences == null ? AdminPreferences.none() : preferences.toDomain();
    }

    public ScoringWeights toWeights() {
        return weights == null ? ScoringWeights.DEFAULT : weights.toDomain();
    }

    public record PreferencesDto(
            @PositiveOrZero BigDecimal budget_cap,
            List<String> wanted_tags,
            @Min(1) Integer min_attendees,
            List<String> blackout_dates,
            String date_range_start,
            String date_range_end
    ) {
        AdminPreferences toDomain() {
            AdminPreferences prefs = AdminPreferences.of(budget_cap, wanted_tags, blackout_dates,
                    date_range_start, date_range_end);
            return new AdminPreferences(prefs.budgetCap(), prefs.wantedTags(),
                    min_attendees == null ? 1 : min_attendees, prefs.blackoutDates(),
                    prefs.dateRangeStart(), prefs.dateRangeEnd());
        }
    }

    public record WeightsDto(
            @DecimalMin("0.0") double interest,
            @DecimalMin("0.0") double overlap,
            @DecimalMin("0.0") double admin
    ) {
        ScoringWeights toDomain() {
            return new ScoringWeights(interest, overlap, admin);
        }
    }
}
