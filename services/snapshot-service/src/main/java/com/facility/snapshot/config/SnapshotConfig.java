package com.facility.snapshot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SnapshotConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
