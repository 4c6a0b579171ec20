package com.yescount.planner.domain.heuristics;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads price ranges out of free text. Never throws.
 */
public final class PriceHeuristics {

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern FREE_WORD = Pattern.compile("\\bfree\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOLLAR_AMOUNT = Pattern.compile(
            "\\$\\s?\\d+(?:\\.\\d{1,2})?(?:\\s*(?:-|–|—|to)\\s*\\$?\\s?\\d+(?:\\.\\d{1,2})?)?",
            Pattern.CASE_INSENSITIVE);

    private PriceHeuristics() {
    }

    /**
     * "Free" → (0,0); no number → unknown; one number → (n,n); more → (min,max).
     */
    public static PriceRange parse(String text) {
        if (text == null || text.isBlank()) {
            return PriceRange.UNKNOWN;
        }
        String lowered = text.toLowerCase(Locale.ROOT).strip();
        if (lowered.contains("free")) {
            return PriceRange.FREE;
        }

        List<BigDecimal> numbers = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(lowered);
        while (matcher.find()) {
            numbers.add(new BigDecimal(matcher.group()));
        }
        if (numbers.isEmpty()) {
            return PriceRange.UNKNOWN;
        }
        BigDecimal min = numbers.stream().min(Comparator.naturalOrder()).orElseThrow();
        BigDecimal max = numbers.stream().max(Comparator.naturalOrder()).orElseThrow();
        return new PriceRange(min, max);
    }

    /**
     * Locate the price-looking part of a longer text so that dates and counts are not read as prices.
     *
     * @return "free", the first dollar amount or range, or null when the text mentions no price
     */
    public static String findPriceText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        if (FREE_WORD.matcher(text).find()) {
            return "free";
        }
        Matcher matcher = DOLLAR_AMOUNT.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }
}
