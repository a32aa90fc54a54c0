package com.facility.snapshot.config;

import com.facility.common.auth.Authenticator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Credential checks for the read API, built from {@code telemetry.auth.*}.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public Authenticator authenticator(TelemetryProperties properties) {
        return Authenticator.withSecrets(properties.getAuth().toSecrets());
    }
}
