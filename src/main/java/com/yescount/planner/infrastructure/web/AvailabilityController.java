package com.yescount.planner.infrastructure.web;

import com.yescount.planner.domain.availability.AvailabilityAggregator;
import com.yescount.planner.infrastructure.web.dto.AvailabilityRequest;
import com.yescount.planner.infrastructure.web.dto.AvailabilityResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/availability")
public class AvailabilityController {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityController.class);

    private final AvailabilityAggregator availabilityAggregator;

    public AvailabilityController(AvailabilityAggregator availabilityAggregator) {
        this.availabilityAggregator = availabilityAggregator;
    }

    @PostMapping("/summary")
    public ResponseEntity<AvailabilityResponse> summarize(@Valid @RequestBody AvailabilityRequest request) {
        logger.debug("Aggregating {} availability rows for {} participants",
                request.entries().size(), request.participant_count());
        var group = availabilityAggregator.aggregate(request.toEntries(), request.participant_count());
        return ResponseEntity.ok(AvailabilityResponse.fromGroup(group));
    }
}
