package com.yescount.planner.domain.recommendation;

import com.yescount.planner.domain.model.AdminPreferences;
import com.yescount.planner.domain.model.Event;

import java.util.Locale;

/**
 * Planner constraints applied before scoring. Event dates are compared as YYYY-MM-DD strings,
 * so undated events always pass the date rules.
 */
public final class AdminRules {

    private AdminRules() {
    }

    public static boolean passesHardFilters(Event event, AdminPreferences prefs) {
        if (prefs.budgetCap() != null && event.priceMax() != null
                && event.priceMax().compareTo(prefs.budgetCap()) > 0) {
            return false;
        }
        String day = event.dateStartDay();
        if (day.isEmpty()) {
            return true;
        }
        if (prefs.blackoutDates().contains(day)) {
            return false;
        }
        if (prefs.dateRangeStart() != null && day.compareTo(prefs.dateRangeStart()) < 0) {
            return false;
        }
        return prefs.dateRangeEnd() == null || day.compareTo(prefs.dateRangeEnd()) <= 0;
    }

    /**
     * Share of the wanted tags the event carries; 0 when nothing is wanted.
     */
    public static double adminScore(Event event, AdminPreferences prefs) {
        if (prefs.wantedTags().isEmpty()) {
            return 0.0;
        }
        long matched = event.tags().stream()
                .map(tag -> tag.toLowerCase(Locale.ROOT))
                .distinct()
                .filter(prefs.wantedTags()::contains)
                .count();
        return (double) matched / prefs.wantedTags().size();
    }
}
