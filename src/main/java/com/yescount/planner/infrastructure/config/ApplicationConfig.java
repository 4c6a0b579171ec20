package com.yescount.planner.infrastructure.config;

import com.yescount.planner.domain.model.IngestionSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IngestionSettings ingestionSettings(IngestionProperties properties) {
        return properties.toSettings();
    }
}
