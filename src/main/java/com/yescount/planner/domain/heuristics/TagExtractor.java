package com.yescount.planner.domain.heuristics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Keyword-to-tag table applied to an event's title and description.
 */
public final class TagExtractor {

    public static final Map<String, List<String>> KEYWORDS_BY_TAG;

    static {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("immersive", List.of("immersive", "interactive"));
        table.put("artsy", List.of("gallery", "art", "museum"));
        table.put("outdoor", List.of("park", "outdoor", "garden", "rooftop"));
        table.put("nightlife", List.of("club", "bar", "dj", "nightlife"));
        table.put("family", List.of("family", "kids", "children"));
        KEYWORDS_BY_TAG = Map.copyOf(table);
    }

    private TagExtractor() {
    }

    /**
     * @return sorted tags whose keywords occur (as substrings) in the text
     */
    public static List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        TreeSet<String> tags = new TreeSet<>();
        KEYWORDS_BY_TAG.forEach((tag, keywords) -> {
            if (keywords.stream().anyMatch(lowered::contains)) {
                tags.add(tag);
            }
        });
        return List.copyOf(tags);
    }
}
