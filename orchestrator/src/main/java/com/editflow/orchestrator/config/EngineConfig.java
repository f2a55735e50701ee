package com.editflow.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 *
 * Scheduling drives the resource governor's periodic sample. The clock is a
 * bean so scoring and backoff can be tested against a fixed instant.
 */
@Configuration
@EnableScheduling
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
