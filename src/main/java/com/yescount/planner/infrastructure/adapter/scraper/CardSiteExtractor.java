package com.yescount.planner.infrastructure.adapter.scraper;

import com.yescount.planner.domain.heuristics.DateHeuristics;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Generic extractor: one event per card-like element.
 */
@Component
public class CardSiteExtractor implements SiteExtractor {

    private static final Logger logger = LoggerFactory.getLogger(CardSiteExtractor.class);

    static final String CARD_SELECTOR = "article, .event, .card";
    static final int TITLE_FALLBACK_LENGTH = 120;
    static final int LISTICLE_MIN_LENGTH = 1500;
    static final int LISTICLE_MAX_DATES = 3;

    private final DateHeuristics dateHeuristics;

    public CardSiteExtractor(DateHeuristics dateHeuristics) {
        this.dateHeuristics = dateHeuristics;
    }

    @Override
    public Set<String> sourceNames() {
        return Set.of();
    }

    @Override
    public List<ScrapedEventRecord> extract(Document page, String pageUrl, String sourceLabel) {
        List<ScrapedEventRecord> records = new ArrayList<>();
        int index = 0;
        for (Element card : page.select(CARD_SELECTOR)) {
            index++;
            if (wrapsOtherCards(card)) {
                logger.debug("Skipping card {} on {}: contains nested cards", index, pageUrl);
                continue;
            }
            String text = card.text().strip();
            if (isListicle(text)) {
                logger.debug("Skipping listicle card {} on {} ({} chars)", index, pageUrl, text.length());
                continue;
            }
            String title = titleOf(card, text, index);
            records.add(ExtractionSupport.toRecord(title, text, ExtractionSupport.linkUrl(card, pageUrl),
                    ExtractionSupport.imageUrl(card, pageUrl), sourceLabel, dateHeuristics));
        }
        List<ScrapedEventRecord> distinct = ExtractionSupport.distinctBySourceId(records);
        logger.debug("Extracted {} cards from {}", distinct.size(), pageUrl);
        return distinct;
    }

    /**
     * The innermost match is the card; a wrapper around it would repeat the same listing.
     */
    static boolean wrapsOtherCards(Element card) {
        return card.select(CARD_SELECTOR).stream().anyMatch(nested -> nested != card);
    }

    boolean isListicle(String text) {
        return text.length() > LISTICLE_MIN_LENGTH && dateHeuristics.countDatePhrases(text) > LISTICLE_MAX_DATES;
    }

    private static String titleOf(Element card, String text, int index) {
        Element heading = card.selectFirst("h1, h2, h3, h4, h5, h6");
        if (heading != null && !heading.text().isBlank()) {
            return heading.text().strip();
        }
        Element link = card.selectFirst("a");
        if (link != null && !link.text().isBlank()) {
            return link.text().strip();
        }
        if (!text.isEmpty()) {
            return text.substring(0, Math.min(TITLE_FALLBACK_LENGTH, text.length())).strip();
        }
        return "Scraped Event " + index;
    }
}
