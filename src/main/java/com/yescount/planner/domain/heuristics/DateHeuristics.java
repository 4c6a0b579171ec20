package com.yescount.planner.domain.heuristics;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Natural-language date reading for scraped text, plus the lenient ISO parser used for API fields.
 * All results are UTC timestamps at midnight unless the input carried a time.
 */
@Component
public class DateHeuristics {

    private static final String MONTH =
            "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";
    private static final String DAY = "(\\d{1,2})(?:st|nd|rd|th)?(?!\\d)";
    private static final String YEAR = "(?:,?\\s*((?:19|20)\\d{2})(?!\\d))?";
    private static final String DASH = "\\s*[-–—]\\s*";

    private static final Pattern RANGE = Pattern.compile(
            "\\b" + MONTH + "\\s+" + DAY + DASH + "(?:" + MONTH + "\\s+)?" + DAY + YEAR,
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b" + MONTH + "\\s+" + DAY + YEAR,
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DAY = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern US_DAY = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4})\\b");

    private static final List<String> MONTH_PREFIXES = List.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    private final Clock clock;

    public DateHeuristics(Clock clock) {
        this.clock = clock;
    }

    /**
     * Classify the date phrases found in a card or section text.
     */
    public DateExtraction extract(String text) {
        if (text == null || text.isBlank()) {
            return DateExtraction.unclear();
        }
        Phrases phrases = scan(text);

        if (phrases.ranges.size() == 1 && phrases.singles.isEmpty()) {
            ResolvedRange range = phrases.ranges.get(0);
            if (range == null) {
                return DateExtraction.unclear();
            }
            return DateExtraction.range(midnight(range.start()), midnight(range.end()));
        }
        int distinct = phrases.distinctCount();
        if (distinct == 0) {
            return DateExtraction.unclear();
        }
        if (distinct == 1 && phrases.ranges.isEmpty()) {
            Object only = phrases.singles.iterator().next();
            return only instanceof LocalDate date
                    ? DateExtraction.single(midnight(date))
                    : DateExtraction.unclear();
        }
        return DateExtraction.multiple();
    }

    /**
     * Number of distinct date phrases (ranges count once) in the text.
     */
    public int countDatePhrases(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return scan(text).distinctCount();
    }

    /**
     * ISO-first parsing for already structured values: offset timestamp, local timestamp,
     * then the first ten characters as a plain date. Returns null instead of throwing.
     * The wall-clock time is kept and labelled UTC, so the calendar day never shifts.
     */
    public OffsetDateTime parseIso(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.strip().replace(' ', 'T');

        OffsetDateTime parsed = tryParse(text, s -> OffsetDateTime.parse(s).toLocalDateTime().atOffset(ZoneOffset.UTC));
        if (parsed == null) {
            parsed = tryParse(text, s -> LocalDateTime.parse(s).atOffset(ZoneOffset.UTC));
        }
        if (parsed == null && text.length() >= 10) {
            parsed = tryParse(text.substring(0, 10), s -> midnight(LocalDate.parse(s)));
        }
        return parsed;
    }

    public int currentYear() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).getYear();
    }

    // ===== Private Helper Methods =====

    private Phrases scan(String text) {
        Phrases phrases = new Phrases();
        List<int[]> rangeSpans = new ArrayList<>();

        Matcher range = RANGE.matcher(text);
        while (range.find()) {
            rangeSpans.add(new int[] {range.start(), range.end()});
            ResolvedRange resolved = resolveRange(range);
            if (!phrases.ranges.contains(resolved) || resolved == null) {
                phrases.ranges.add(resolved);
            }
        }

        Matcher monthDay = MONTH_DAY.matcher(text);
        while (monthDay.find()) {
            if (overlaps(rangeSpans, monthDay.start())) {
                continue;
            }
            phrases.singles.add(keyFor(resolveMonthDay(monthDay.group(1), monthDay.group(2), monthDay.group(3)),
                    monthDay.group()));
        }

        Matcher iso = ISO_DAY.matcher(text);
        while (iso.find()) {
            phrases.singles.add(keyFor(safeDate(iso.group(1), iso.group(2), iso.group(3)), iso.group()));
        }

        Matcher us = US_DAY.matcher(text);
        while (us.find()) {
            phrases.singles.add(keyFor(safeDate(us.group(3), us.group(1), us.group(2)), us.group()));
        }
        return phrases;
    }

    private ResolvedRange resolveRange(Matcher matcher) {
        String startMonth = matcher.group(1);
        String startDay = matcher.group(2);
        String endMonth = matcher.group(3) != null ? matcher.group(3) : startMonth;
        String endDay = matcher.group(4);
        int year = matcher.group(5) != null ? Integer.parseInt(matcher.group(5)) : currentYear();

        LocalDate start = resolveMonthDay(startMonth, startDay, String.valueOf(year));
        LocalDate end = resolveMonthDay(endMonth, endDay, String.valueOf(year));
        if (start == null || end == null) {
            return null;
        }
        if (end.isBefore(start)) {
            if (matcher.group(3) == null) {
                return null;
            }
            end = end.plusYears(1);
        }
        return new ResolvedRange(start, end);
    }

    private LocalDate resolveMonthDay(String monthName, String day, String year) {
        int month = MONTH_PREFIXES.indexOf(monthName.toLowerCase(Locale.ROOT).substring(0, 3)) + 1;
        int resolvedYear = year != null ? Integer.parseInt(year) : currentYear();
        return safeDate(String.valueOf(resolvedYear), String.valueOf(month), day);
    }

    private static LocalDate safeDate(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }

    private static Object keyFor(LocalDate date, String phrase) {
        return date != null ? date : phrase.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static boolean overlaps(List<int[]> spans, int position) {
        return spans.stream().anyMatch(span -> position >= span[0] && position < span[1]);
    }

    private static OffsetDateTime tryParse(String text, Function<String, OffsetDateTime> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static OffsetDateTime midnight(LocalDate date) {
        return date.atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    private record ResolvedRange(LocalDate start, LocalDate end) {}

    private static final class Phrases {
        // a null entry is a range phrase that did not resolve
        final List<ResolvedRange> ranges = new ArrayList<>();
        // LocalDate when the phrase resolved, normalised phrase text otherwise
        final Set<Object> singles = new LinkedHashSet<>();

        int distinctCount() {
            return ranges.size() + singles.size();
        }
    }
}
