package com.yescount.planner.infrastructure.web;

import com.yescount.planner.application.RecommendEvents;
import com.yescount.planner.domain.recommendation.RecommendationEngine;
import com.yescount.planner.infrastructure.web.dto.RecommendationRequest;
import com.yescount.planner.infrastructure.web.dto.RecommendationResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/recommendations")
public class RecommendationController {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationController.class);

    private final RecommendEvents recommendEvents;

    public RecommendationController(RecommendEvents recommendEvents) {
        this.recommendEvents = recommendEvents;
    }

    @PostMapping
    public ResponseEntity<RecommendationResponse> recommend(@Valid @RequestBody RecommendationRequest request) {
        int topN = request.top_n() != null ? request.top_n() : RecommendationEngine.DEFAULT_TOP_N;
        logger.info("Recommending from {} candidates, {} voted events, top_n={}",
                request.eventIds().size(), request.voteTallies().size(), topN);

        try {
            var ranked = recommendEvents.execute(request.eventIds(), request.voteTallies(),
                    request.overlapByEventId(), request.toPreferences(), request.toWeights(), topN);
            return ResponseEntity.ok(RecommendationResponse.fromRecommendations(ranked));

        } catch (Exception e) {
            logger.error("Error computing recommendations", e);
            return ResponseEntity.internalServerError()
                    .body(RecommendationResponse.empty());
        }
    }
}
