package com.yescount.planner.infrastructure.cron;

import com.yescount.planner.application.RunIngestion;
import com.yescount.planner.domain.model.IngestionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Verifies that the scheduler triggers a non-forced ingestion run.
 */
@SpringBootTest(classes = {
        ScheduledIngestion.class,
        ScheduledIngestionIntegrationTest.TestSchedulingConfig.class
})
@TestPropertySource(properties = {
        "yescount.ingestion.auto-refresh=true",
        "yescount.ingestion.cron=* * * * * *"
})
class ScheduledIngestionIntegrationTest {

    @MockBean
    private RunIngestion runIngestion;

    @Configuration
    @EnableScheduling
    static class TestSchedulingConfig {
    }

    @BeforeEach
    void setUp() {
        when(runIngestion.run(false)).thenReturn(IngestionOutcome.skipped("fresh_enough"));
    }

    @Test
    void shouldRunNonForcedIngestion() {
        await()
                .atMost(Duration.ofSeconds(3))
                .untilAsserted(() -> verify(runIngestion, atLeastOnce()).run(false));
        verify(runIngestion, never()).run(true);
    }
}
