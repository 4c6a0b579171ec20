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
import java.util.regex.Pattern;

/**
 * For sites that list many events inside a single article: every h2/h3 heading starts a segment
 * that runs until the next heading or {@link #SEGMENT_MAX_LENGTH} characters.
 */
@Component
public class HeadingSegmentSiteExtractor implements SiteExtractor {

    private static final Logger logger = LoggerFactory.getLogger(HeadingSegmentSiteExtractor.class);

    static final int SEGMENT_MAX_LENGTH = 1200;

    private static final Pattern LISTICLE_HEADING = Pattern.compile(
            "^\\s*(?:top\\s+\\d+|\\d+\\s+best\\b|best\\b|things\\s+to\\s+do\\b)", Pattern.CASE_INSENSITIVE);

    private final DateHeuristics dateHeuristics;

    public HeadingSegmentSiteExtractor(DateHeuristics dateHeuristics) {
        this.dateHeuristics = dateHeuristics;
    }

    @Override
    public Set<String> sourceNames() {
        return Set.of("secretnyc");
    }

    @Override
    public List<ScrapedEventRecord> extract(Document page, String pageUrl, String sourceLabel) {
        Element body = page.selectFirst("article");
        if (body == null) {
            body = page.selectFirst("main");
        }
        if (body == null) {
            body = page.body();
        }

        List<ScrapedEventRecord> records = new ArrayList<>();
        for (Element heading : body.select("h2, h3")) {
            String title = heading.text().strip();
            if (title.isEmpty() || isListicleHeading(title)) {
                continue;
            }
            Segment segment = collectSegment(heading);
            String imageUrl = null;
            String linkUrl = pageUrl;
            for (Element element : segment.elements()) {
                if (imageUrl == null) {
                    imageUrl = ExtractionSupport.imageUrl(element, pageUrl);
                }
                if (linkUrl.equals(pageUrl)) {
                    linkUrl = ExtractionSupport.linkUrl(element, pageUrl);
                }
            }
            // headings often carry the date ("Gatsby Gala on April 18")
            String signalText = (title + " " + segment.text()).strip();
            records.add(ExtractionSupport.toRecord(title, segment.text(), signalText, linkUrl, imageUrl,
                    sourceLabel, dateHeuristics));
        }
        List<ScrapedEventRecord> distinct = ExtractionSupport.distinctBySourceId(records);
        logger.debug("Extracted {} heading segments from {}", distinct.size(), pageUrl);
        return distinct;
    }

    static boolean isListicleHeading(String title) {
        return LISTICLE_HEADING.matcher(title).find();
    }

    private static Segment collectSegment(Element heading) {
        StringBuilder text = new StringBuilder();
        List<Element> elements = new ArrayList<>();
        Element sibling = heading.nextElementSibling();
        while (sibling != null && !sibling.is("h2, h3") && text.length() < SEGMENT_MAX_LENGTH) {
            elements.add(sibling);
            String chunk = sibling.text().strip();
            if (!chunk.isEmpty()) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(chunk);
            }
            sibling = sibling.nextElementSibling();
        }
        String flattened = text.length() > SEGMENT_MAX_LENGTH ? text.substring(0, SEGMENT_MAX_LENGTH) : text.toString();
        return new Segment(flattened, elements);
    }

    private record Segment(String text, List<Element> elements) {}
}
