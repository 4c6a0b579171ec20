package com.yescount.planner.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Planner-defined constraints for one planning session. Dates are YYYY-MM-DD strings.
 */
public record AdminPreferences(
        BigDecimal budgetCap,
        Set<String> wantedTags,
        int minAttendees,
        Set<String> blackoutDates,
        String dateRangeStart,
        String dateRangeEnd
) {
    public AdminPreferences {
        wantedTags = wantedTags == null ? Set.of() : wantedTags.stream()
                .map(tag -> tag.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        blackoutDates = blackoutDates == null ? Set.of() : Set.copyOf(blackoutDates);
        minAttendees = Math.max(minAttendees, 1);
        dateRangeStart = blankToNull(dateRangeStart);
        dateRangeEnd = blankToNull(dateRangeEnd);
    }

    public static AdminPreferences none() {
        return new AdminPreferences(null, Set.of(), 1, Set.of(), null, null);
    }

    public static AdminPreferences of(BigDecimal budgetCap, List<String> wantedTags, List<String> blackoutDates,
                                      String dateRangeStart, String dateRangeEnd) {
        return new AdminPreferences(budgetCap,
                wantedTags == null ? Set.of() : Set.copyOf(wantedTags),
                1,
                blackoutDates == null ? Set.of() : Set.copyOf(blackoutDates),
                dateRangeStart, dateRangeEnd);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
