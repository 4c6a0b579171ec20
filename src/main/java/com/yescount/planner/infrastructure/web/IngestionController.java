package com.yescount.planner.infrastructure.web;

import com.yescount.planner.application.RunIngestion;
import com.yescount.planner.domain.model.OutcomeStatus;
import com.yescount.planner.infrastructure.web.dto.IngestionRunResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual trigger for the ingestion pipeline. The run executes on the request thread.
 */
@RestController
@RequestMapping("/ingestion")
public class IngestionController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionController.class);

    private final RunIngestion runIngestion;

    public IngestionController(RunIngestion runIngestion) {
        this.runIngestion = runIngestion;
    }

    @PostMapping("/runs")
    public ResponseEntity<IngestionRunResponse> triggerRun(
            @RequestParam(value = "force", defaultValue = "false") boolean force
    ) {
        logger.info("Manual ingestion requested force={}", force);
        var outcome = runIngestion.run(force);
        var response = IngestionRunResponse.fromOutcome(outcome);

        if (outcome.status() == OutcomeStatus.SKIPPED && "already_running".equals(outcome.reason())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
