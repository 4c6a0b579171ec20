package com.yescount.planner.infrastructure.cron;

import com.yescount.planner.application.RunIngestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic non-forced ingestion; the staleness gate decides whether anything is fetched.
 */
@Service
@ConditionalOnProperty(prefix = "yescount.ingestion", name = "auto-refresh", havingValue = "true",
        matchIfMissing = true)
public class ScheduledIngestion {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledIngestion.class);
    private final RunIngestion runIngestion;

    public ScheduledIngestion(RunIngestion runIngestion) {
        this.runIngestion = runIngestion;
    }

    @Scheduled(cron = "${yescount.ingestion.cron:0 0 6 * * *}", zone = "UTC")
    public void refresh() {
        logger.info("Running scheduled ingestion");
        var outcome = runIngestion.run(false);
        logger.info("Scheduled ingestion finished status={} events={} reason={}",
                outcome.status(), outcome.eventsUpserted(), outcome.reason());
    }
}
