package com.yescount.planner.infrastructure.web;

import com.yescount.planner.application.CurateVotingList;
import com.yescount.planner.application.SearchEvents;
import com.yescount.planner.domain.curation.CurationEngine;
import com.yescount.planner.domain.model.EventQuery;
import com.yescount.planner.infrastructure.web.dto.CuratedEventsResponse;
import com.yescount.planner.infrastructure.web.dto.EventSearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final CurateVotingList curateVotingList;
    private final SearchEvents searchEvents;

    public EventController(CurateVotingList curateVotingList, SearchEvents searchEvents) {
        this.curateVotingList = curateVotingList;
        this.searchEvents = searchEvents;
    }

    @GetMapping("/curated")
    public ResponseEntity<CuratedEventsResponse> curatedEvents(
            @RequestParam(value = "year", required = false) Integer year,
            @RequestParam(value = "month", required = false) Integer month,
            @RequestParam(value = "websites_only", defaultValue = "true") boolean websitesOnly,
            @RequestParam(value = "top_n", defaultValue = "" + CurationEngine.DEFAULT_TOP_N) int topN
    ) {
        logger.info("Curating voting list year={} month={} websites_only={} top_n={}",
                year, month, websitesOnly, topN);

        if ((month != null && (month < 1 || month > 12)) || topN < 1) {
            logger.warn("Invalid curation request: month={} top_n={}", month, topN);
            return ResponseEntity.badRequest()
                    .body(CuratedEventsResponse.empty());
        }

        try {
            var curated = curateVotingList.execute(year, month, websitesOnly, topN);
            logger.info("Curated {} events", curated.events().size());
            return ResponseEntity.ok(CuratedEventsResponse.from(curated));

        } catch (Exception e) {
            logger.error("Error curating events", e);
            return ResponseEntity.internalServerError()
                    .body(CuratedEventsResponse.empty());
        }
    }

    @GetMapping("/search")
    public ResponseEntity<EventSearchResponse> searchEvents(
            @RequestParam(value = "q", defaultValue = "") String text,

            @RequestParam(value = "date_from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            LocalDate dateFrom,

            @RequestParam(value = "date_to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            LocalDate dateTo,

            @RequestParam(value = "price_max", required = false) BigDecimal priceMax,
            @RequestParam(value = "tags", required = false) List<String> tags
    ) {
        logger.info("Searching events q='{}' from {} to {} price_max={} tags={}",
                text, dateFrom, dateTo, priceMax, tags);

        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            logger.warn("Invalid date range: start {} is after end {}", dateFrom, dateTo);
            return ResponseEntity.badRequest()
                    .body(EventSearchResponse.empty());
        }

        try {
            var events = searchEvents.execute(new EventQuery(text, dateFrom, dateTo, priceMax, tags));
            logger.info("Found {} events", events.size());
            return ResponseEntity.ok(EventSearchResponse.fromEvents(events));

        } catch (Exception e) {
            logger.error("Error searching events", e);
            return ResponseEntity.internalServerError()
                    .body(EventSearchResponse.empty());
        }
    }
}
