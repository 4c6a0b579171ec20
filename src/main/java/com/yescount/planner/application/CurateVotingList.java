package com.yescount.planner.application;

import com.yescount.planner.domain.curation.CurationEngine;
import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.VotingWindow;
import com.yescount.planner.domain.port.out.EventRepository;
import com.yescount.planner.domain.voting.VotingWindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the list participants vote on. Without an explicit month it targets the month the
 * current voting window is for.
 */
@Service
public class CurateVotingList {

    private static final Logger logger = LoggerFactory.getLogger(CurateVotingList.class);

    private final EventRepository eventRepository;
    private final CurationEngine curationEngine;
    private final VotingWindowCalculator votingWindowCalculator;

    public CurateVotingList(EventRepository eventRepository, CurationEngine curationEngine,
                            VotingWindowCalculator votingWindowCalculator) {
        this.eventRepository = eventRepository;
        this.curationEngine = curationEngine;
        this.votingWindowCalculator = votingWindowCalculator;
    }

    public CuratedList execute(Integer targetYear, Integer targetMonth, boolean websitesOnly, int topN) {
        VotingWindow window = votingWindowCalculator.current();
        Integer year = targetYear;
        Integer month = targetMonth;
        if (year == null && month == null) {
            year = window.targetYear();
            month = window.targetMonth();
        }

        List<Event> stored = eventRepository.findAll();
        List<Event> curated = curationEngine.curate(stored, year, month, websitesOnly, topN);
        logger.debug("Curated {} of {} stored events for {}-{}", curated.size(), stored.size(), year, month);
        return new CuratedList(window, curated);
    }

    public record CuratedList(VotingWindow window, List<Event> events) {}
}
