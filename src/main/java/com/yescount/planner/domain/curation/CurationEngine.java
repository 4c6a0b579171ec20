package com.yescount.planner.domain.curation;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.EventSource;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks and orders the events offered on the monthly voting list.
 * Filters out non-events (news, closures, listicles), narrows to the target month
 * and ranks what is left by a text-richness and keyword heuristic.
 */
@Component
public class CurationEngine {

    public static final int DEFAULT_TOP_N = 30;

    static final Set<String> PRIORITY_KEYWORDS = Set.of(
            "immersive", "theater", "theatre", "pop-up", "popup", "exhibit", "festival");

    static final Set<String> NON_EVENT_KEYWORDS = Set.of(
            "cheapest", "closure", "closed", "closing", "permanently closed",
            "news", "article", "report", "roundup", "guide to",
            "best bakery", "best restaurant", "best bars", "best things",
            "permanently shut", "shut down", "going out of business",
            "list of", "top 10", "top 15", "top 20", "things to know");

    private static final Comparator<Event> RANKING = Comparator
            .comparingDouble((Event event) -> -qualityScore(event))
            .thenComparingLong(event -> event.id() == null ? 0L : event.id())
            .thenComparing(Event::dateStartIso);

    private final Clock clock;

    public CurationEngine(Clock clock) {
        this.clock = clock;
    }

    public List<Event> curate(List<Event> events, Integer targetYear, Integer targetMonth) {
        return curate(events, targetYear, targetMonth, true, DEFAULT_TOP_N);
    }

    /**
     * @param websitesOnly keep scraped events only
     * @param topN         maximum size of the result
     * @return ranked events, at most topN
     */
    public List<Event> curate(List<Event> events, Integer targetYear, Integer targetMonth,
                              boolean websitesOnly, int topN) {
        List<Event> candidates = events.stream()
                .filter(event -> !websitesOnly || event.source() == EventSource.SCRAPED)
                .filter(CurationEngine::looksLikeEvent)
                .toList();

        List<Event> filtered = candidates.stream()
                .filter(event -> inTargetMonth(dayOf(event), targetYear, targetMonth))
                .toList();

        if (filtered.isEmpty() && (targetYear != null || targetMonth != null)) {
            LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
            List<Event> upcoming = candidates.stream()
                    .filter(event -> {
                        LocalDate day = dayOf(event);
                        return day != null && !day.isBefore(today);
                    })
                    .toList();
            filtered = upcoming.isEmpty() ? candidates : upcoming;
        }

        return filtered.stream()
                .sorted(RANKING)
                .limit(Math.max(topN, 0))
                .toList();
    }

    static double qualityScore(Event event) {
        double richness = Math.min(event.title().length() * 0.5 + event.description().length() * 0.3, 50.0);
        String text = searchableText(event);
        long hits = PRIORITY_KEYWORDS.stream().filter(text::contains).count();
        return richness + Math.min(hits * 10.0, 30.0);
    }

    static boolean looksLikeEvent(Event event) {
        String text = searchableText(event);
        if (NON_EVENT_KEYWORDS.stream().anyMatch(text::contains)) {
            return false;
        }
        String title = event.title().toLowerCase(Locale.ROOT);
        if (title.contains("things to do") || title.contains("happenings") || title.contains("you can't miss")) {
            return false;
        }
        boolean hasDigit = title.chars().anyMatch(Character::isDigit);
        return !(hasDigit && (title.contains("top ") || title.contains("best ")));
    }

    // ===== Private Helper Methods =====

    private static boolean inTargetMonth(LocalDate day, Integer year, Integer month) {
        if (day == null) {
            return false;
        }
        if (year != null && day.getYear() != year) {
            return false;
        }
        return month == null || day.getMonthValue() == month;
    }

    private static LocalDate dayOf(Event event) {
        String day = event.dateStartDay();
        if (day.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(day);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String searchableText(Event event) {
        return (event.title() + " " + event.description()).toLowerCase(Locale.ROOT);
    }
}
