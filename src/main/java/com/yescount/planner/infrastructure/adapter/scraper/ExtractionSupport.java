package com.yescount.planner.infrastructure.adapter.scraper;

import com.yescount.planner.domain.heuristics.DateExtraction;
import com.yescount.planner.domain.heuristics.DateHeuristics;
import com.yescount.planner.domain.heuristics.PriceHeuristics;
import org.jsoup.nodes.Element;
import org.springframework.util.DigestUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Heuristics shared by the site extractors: image and link resolution, stable ids and
 * turning a block of text into a record.
 */
final class ExtractionSupport {

    private static final List<String> IMAGE_ATTRIBUTES = List.of("src", "data-src", "data-lazy-src");
    private static final int HASH_LENGTH = 12;

    private ExtractionSupport() {
    }

    static ScrapedEventRecord toRecord(String title, String text, String url, String imageUrl,
                                       String sourceLabel, DateHeuristics dateHeuristics) {
        return toRecord(title, text, text, url, imageUrl, sourceLabel, dateHeuristics);
    }

    /**
     * @param text        description of the event
     * @param signalText  text searched for dates and prices, may include more than the description
     */
    static ScrapedEventRecord toRecord(String title, String text, String signalText, String url, String imageUrl,
                                       String sourceLabel, DateHeuristics dateHeuristics) {
        DateExtraction dates = dateHeuristics.extract(signalText);
        return new ScrapedEventRecord(
                title,
                text,
                dates.start() != null ? dates.start().toString() : null,
                dates.end() != null ? dates.end().toString() : null,
                dates.status().code(),
                "",
                PriceHeuristics.findPriceText(signalText),
                url,
                imageUrl,
                sourceId(sourceLabel, title));
    }

    /**
     * {@code <label>-<first 12 hex chars of md5(title)>}, stable across page reorderings.
     */
    static String sourceId(String sourceLabel, String title) {
        String hash = DigestUtils.md5DigestAsHex(title.getBytes(StandardCharsets.UTF_8));
        return sourceLabel + "-" + hash.substring(0, HASH_LENGTH);
    }

    /**
     * First record per source id wins; repeated ids would be upserted twice in one run.
     */
    static List<ScrapedEventRecord> distinctBySourceId(List<ScrapedEventRecord> records) {
        Map<String, ScrapedEventRecord> bySourceId = new LinkedHashMap<>();
        for (ScrapedEventRecord record : records) {
            bySourceId.putIfAbsent(record.sourceId(), record);
        }
        return List.copyOf(bySourceId.values());
    }

    static String imageUrl(Element scope, String pageUrl) {
        Element image = scope.is("img") ? scope : scope.selectFirst("img");
        if (image == null) {
            return null;
        }
        return IMAGE_ATTRIBUTES.stream()
                .map(image::attr)
                .filter(value -> !value.isBlank())
                .findFirst()
                .map(value -> absoluteUrl(pageUrl, value))
                .orElse(null);
    }

    static String linkUrl(Element scope, String pageUrl) {
        Element link = scope.is("a[href]") ? scope : scope.selectFirst("a[href]");
        if (link == null) {
            return pageUrl;
        }
        String resolved = absoluteUrl(pageUrl, link.attr("href"));
        return resolved != null ? resolved : pageUrl;
    }

    /**
     * Resolves against the page URL; protocol-relative URLs become https.
     *
     * @return the absolute URL, or null when the value cannot be resolved
     */
    static String absoluteUrl(String pageUrl, String value) {
        String raw = value.strip();
        if (raw.isEmpty()) {
            return null;
        }
        if (raw.startsWith("//")) {
            return "https:" + raw;
        }
        try {
            return URI.create(pageUrl).resolve(raw.replace(" ", "%20")).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
