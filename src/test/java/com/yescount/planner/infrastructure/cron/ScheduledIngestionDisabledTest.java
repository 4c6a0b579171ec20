package com.yescount.planner.infrastructure.cron;

import com.yescount.planner.application.RunIngestion;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * With auto refresh off the scheduler bean is never registered.
 */
@SpringBootTest(classes = {
        ScheduledIngestion.class,
        ScheduledIngestionDisabledTest.TestSchedulingConfig.class
})
@TestPropertySource(properties = {
        "yescount.ingestion.auto-refresh=false",
        "yescount.ingestion.cron=* * * * * *"
})
class ScheduledIngestionDisabledTest {

    @MockBean
    private RunIngestion runIngestion;

    @Autowired
    private ApplicationContext context;

    @Configuration
    @EnableScheduling
    static class TestSchedulingConfig {
    }

    @Test
    void shouldNotScheduleWhenDisabled() {
        await().during(Duration.ofMillis(1500))
                .atMost(Duration.ofSeconds(3))
                .untilAsserted(() -> verify(runIngestion, never()).run(false));

        assertThat(context.getBeansOfType(ScheduledIngestion.class)).isEmpty();
    }
}
