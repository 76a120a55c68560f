package com.collectiveip.api.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;

@TestConfiguration
public class TestClockConfig {

    @Bean
    @Primary
    public AdjustableClock adjustableClock() {
        return new AdjustableClock(Instant.parse("2026-01-01T00:00:00Z"));
    }
}
