package com.facility.snapshot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("service")
    String service,

    @JsonProperty("database")
    String database,

    @JsonProperty("scheduler_running")
    Boolean schedulerRunning,

    @JsonProperty("error")
    String error,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    public static HealthResponse healthy(String service, boolean schedulerRunning) {
        return new HealthResponse("healthy", service, "connected", schedulerRunning, null, Instant.now());
    }

    public static HealthResponse unhealthy(String service, String error) {
        return new HealthResponse("unhealthy", service, "disconnected", null, error, Instant.now());
    }

    public boolean isHealthy() {
        return "healthy".equals(status);
    }
}
