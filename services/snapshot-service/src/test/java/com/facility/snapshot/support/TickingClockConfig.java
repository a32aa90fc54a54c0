package com.facility.snapshot.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@TestConfiguration
public class TickingClockConfig {

    @Bean
    @Primary
    public Clock tickingClock() {
        return new TickingClock(Instant.parse("2024-01-01T00:00:00Z"), Duration.ofSeconds(1));
    }
}
